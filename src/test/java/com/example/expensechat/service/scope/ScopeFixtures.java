package com.example.expensechat.service.scope;

import com.example.expensechat.entity.Book;
import com.example.expensechat.entity.Category;

import java.util.List;

/** Dữ liệu mẫu dùng chung: user-1 có hai book House (USD) và Trip (EUR). */
public final class ScopeFixtures {

    private ScopeFixtures() {}

    public static final String USER = "user-1";
    public static final String OTHER_USER = "user-2";

    public static final String HOUSE_ID = "11111111-1111-1111-1111-111111111111";
    public static final String TRIP_ID = "22222222-2222-2222-2222-222222222222";
    public static final String HOUSE_FOOD_ID = "33333333-3333-3333-3333-333333333333";
    public static final String TRIP_FOOD_ID = "44444444-4444-4444-4444-444444444444";
    public static final String TRIP_HOTEL_ID = "55555555-5555-5555-5555-555555555555";

    public static Book house() {
        return Book.builder().id(HOUSE_ID).userId(USER).name("House").currency("USD").isArchived(false).build();
    }

    public static Book trip() {
        return Book.builder().id(TRIP_ID).userId(USER).name("Trip").currency("EUR").isArchived(false).build();
    }

    public static Category category(String id, String bookId, String name) {
        return Category.builder().id(id).bookId(bookId).name(name).isDisabled(false).isDefault(false).build();
    }

    public static UserScope scope() {
        return new UserScope(USER, List.of(house(), trip()), List.of(
                category(HOUSE_FOOD_ID, HOUSE_ID, "Food"),
                category(TRIP_FOOD_ID, TRIP_ID, "Food"),
                category(TRIP_HOTEL_ID, TRIP_ID, "Hotel")));
    }

    public static UserScope singleBookScope() {
        return new UserScope(USER, List.of(house()), List.of(category(HOUSE_FOOD_ID, HOUSE_ID, "Food")));
    }
}

package com.example.expensechat.service.sql.validate;

import com.example.expensechat.entity.Book;

/** INSERT expense tham chiếu một category chưa tồn tại trong book đích. */
public record MissingCategory(String categoryName, Book book) {
}

package com.example.expensechat.service.scope;

import com.example.expensechat.entity.Book;
import com.example.expensechat.entity.Category;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ảnh chụp các book (kể cả đã lưu trữ) và category của một người dùng tại thời điểm xử lý.
 * Dùng cho kiểm tra quyền sở hữu, trùng tên và dựng prompt.
 */
public record UserScope(String userId, List<Book> books, List<Category> categories) {

    public UserScope {
        books = List.copyOf(books);
        categories = List.copyOf(categories);
    }

    public Optional<Book> bookById(String id) {
        if (id == null) return Optional.empty();
        return books.stream().filter(b -> b.getId().equals(id)).findFirst();
    }

    public Optional<Book> bookByName(String name) {
        if (name == null) return Optional.empty();
        return books.stream().filter(b -> b.getName().equalsIgnoreCase(name.trim())).findFirst();
    }

    public Optional<Category> categoryById(String id) {
        if (id == null) return Optional.empty();
        return categories.stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    public List<Category> categoriesOf(String bookId) {
        return categories.stream().filter(c -> bookId.equals(c.getBookId())).toList();
    }

    public Optional<Category> categoryByName(String bookId, String name) {
        if (name == null) return Optional.empty();
        return categoriesOf(bookId).stream()
                .filter(c -> c.getName().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public Optional<Book> bookOf(Category category) {
        return bookById(category.getBookId());
    }

    public List<Book> activeBooks() {
        return books.stream().filter(b -> !b.archived()).toList();
    }

    /** Book duy nhất còn hoạt động, nếu người dùng chỉ có một. */
    public Optional<Book> onlyBook() {
        List<Book> active = activeBooks();
        return active.size() == 1 ? Optional.of(active.get(0)) : Optional.empty();
    }

    /** Book có tên xuất hiện (nguyên từ) trong câu của người dùng; ưu tiên tên dài nhất. */
    public Optional<Book> bookNamedIn(String utterance) {
        if (utterance == null || utterance.isBlank()) return Optional.empty();
        String text = utterance.toLowerCase(Locale.ROOT);
        return books.stream()
                .filter(b -> Pattern.compile("(?<![\\p{L}\\d])" + Pattern.quote(b.getName().toLowerCase(Locale.ROOT)) + "(?![\\p{L}\\d])")
                        .matcher(text).find())
                .max(Comparator.comparingInt(b -> b.getName().length()));
    }

    public String bookNames() {
        return books.stream().map(Book::getName).reduce((a, b) -> a + ", " + b).orElse("(none)");
    }
}

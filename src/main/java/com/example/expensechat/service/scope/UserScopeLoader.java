package com.example.expensechat.service.scope;

import com.example.expensechat.entity.Book;
import com.example.expensechat.entity.Category;
import com.example.expensechat.repository.BookRepository;
import com.example.expensechat.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class UserScopeLoader {
    private final BookRepository bookRepository;
    private final CategoryRepository categoryRepository;

    public UserScope load(String userId) {
        List<Book> books = bookRepository.findByUserIdOrderByCreatedAtAsc(userId);
        List<String> bookIds = books.stream().map(Book::getId).toList();
        List<Category> categories = bookIds.isEmpty() ? List.of()
                : categoryRepository.findByBookIdInOrderByNameAsc(bookIds);
        log.debug("Loaded scope for user {}: {} book(s), {} categories", userId, books.size(), categories.size());
        return new UserScope(userId, books, categories);
    }
}

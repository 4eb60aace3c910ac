package com.example.expensechat.repository;

import com.example.expensechat.entity.Book;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BookRepository extends JpaRepository<Book, String> {
    List<Book> findByUserIdOrderByCreatedAtAsc(String userId);
}

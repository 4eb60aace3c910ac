package com.example.expensechat.repository;

import com.example.expensechat.entity.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface CategoryRepository extends JpaRepository<Category, String> {
    List<Category> findByBookIdInOrderByNameAsc(Collection<String> bookIds);
}

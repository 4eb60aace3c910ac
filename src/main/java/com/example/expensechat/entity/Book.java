package com.example.expensechat.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Chỉ đọc: ghi vào books luôn đi qua pipeline SQL đã kiểm soát. */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "books")
public class Book {
    @Id
    private String id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(nullable = false, length = 3)
    private String currency;

    private Boolean isArchived;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean archived() {
        return Boolean.TRUE.equals(isArchived);
    }
}

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

/** Ngữ cảnh hội thoại hiện tại của một người dùng, lưu dạng JSON. */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "chat_contexts")
public class ConversationState {
    @Id
    private String userId;

    @Column(nullable = false, columnDefinition = "text")
    private String contextJson;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}

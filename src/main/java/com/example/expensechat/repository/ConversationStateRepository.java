package com.example.expensechat.repository;

import com.example.expensechat.entity.ConversationState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationStateRepository extends JpaRepository<ConversationState, String> {
}

package com.example.expensechat.repository;

import com.example.expensechat.entity.ConversationTurn;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, String> {
    List<ConversationTurn> findByUserIdOrderByCreatedAtDescRoleAsc(String userId, Pageable pageable);

    @Modifying
    @Query("delete from ConversationTurn t where t.userId = :userId")
    int deleteAllByUserId(@Param("userId") String userId);
}

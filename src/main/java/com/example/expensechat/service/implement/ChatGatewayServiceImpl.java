package com.example.expensechat.service.implement;

import com.example.expensechat.dto.request.ChatRequest;
import com.example.expensechat.dto.response.ChatResponse;

public interface ChatGatewayServiceImpl {
    /**
     * Một lượt chat: xử lý pending expense (nếu có), gọi LLM, chạy từng câu SQL trích được
     * và dựng câu trả lời từ kết quả thực thi.
     * @param userId người dùng đã xác thực
     */
    ChatResponse chat(String userId, ChatRequest request);
}

package com.example.expensechat.service.context;

/** Tham chiếu gọn tới một book/category vừa được nhắc tới. */
public record EntityRef(String id, String name) {

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}

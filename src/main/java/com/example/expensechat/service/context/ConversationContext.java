package com.example.expensechat.service.context;

/**
 * Ngữ cảnh hội thoại đi kèm request/response (server không giữ state).
 * Tối đa một pending expense.
 */
public record ConversationContext(EntityRef lastBook, EntityRef lastCategory, PendingExpense pendingExpense) {

    public static ConversationContext empty() {
        return new ConversationContext(null, null, null);
    }

    /** Bỏ những phần không dùng được (ref thiếu id, pending thiếu dữ liệu hoặc đã bỏ dở). */
    public static ConversationContext sanitize(ConversationContext context) {
        if (context == null) return empty();
        EntityRef book = context.lastBook() != null && context.lastBook().hasId() ? context.lastBook() : null;
        EntityRef category = context.lastCategory() != null && context.lastCategory().hasId() ? context.lastCategory() : null;
        PendingExpense pending = context.pendingExpense() != null && context.pendingExpense().wellFormed()
                ? context.pendingExpense() : null;
        return new ConversationContext(book, category, pending);
    }

    public ConversationContext withLastBook(EntityRef book) {
        return new ConversationContext(book, lastCategory, pendingExpense);
    }

    public ConversationContext withLastCategory(EntityRef category) {
        return new ConversationContext(lastBook, category, pendingExpense);
    }

    public ConversationContext withPending(PendingExpense pending) {
        return new ConversationContext(lastBook, lastCategory, pending);
    }

    public ConversationContext clearPending() {
        return withPending(null);
    }

    public boolean hasPending() {
        return pendingExpense != null;
    }
}

package com.example.expensechat.service.context;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Một expense đang chờ category. Bất biến: mỗi chuyển trạng thái trả về bản mới,
 * chuyển sai trạng thái ném IllegalStateException.
 *
 * @param book         book đích đã xác định
 * @param categoryName tên category chưa tồn tại trong book đó
 * @param category     category đã tạo (chỉ có khi READY)
 * @param sourceText   câu gốc của người dùng, dùng lại để chuẩn hoá tiền tệ
 */
public record PendingExpense(BigDecimal amount,
                             String description,
                             String paymentMethod,
                             String date,
                             EntityRef book,
                             String categoryName,
                             EntityRef category,
                             String sourceText,
                             CategoryResolution state) {

    public static PendingExpense resolving(BigDecimal amount, String description, String paymentMethod,
                                           String date, EntityRef book, String categoryName, String sourceText) {
        return new PendingExpense(amount, description, paymentMethod, date, book, categoryName, null,
                sourceText, CategoryResolution.RESOLVING);
    }

    public PendingExpense needsCategory() {
        require(Set.of(CategoryResolution.RESOLVING));
        return to(CategoryResolution.NEEDS_CATEGORY, category);
    }

    public PendingExpense awaitingConfirmation() {
        require(Set.of(CategoryResolution.NEEDS_CATEGORY));
        return to(CategoryResolution.AWAITING_CONFIRMATION, category);
    }

    public PendingExpense ready(EntityRef createdCategory) {
        require(Set.of(CategoryResolution.RESOLVING, CategoryResolution.AWAITING_CONFIRMATION));
        return to(CategoryResolution.READY, createdCategory);
    }

    public PendingExpense abandoned() {
        require(Set.of(CategoryResolution.RESOLVING, CategoryResolution.NEEDS_CATEGORY,
                CategoryResolution.AWAITING_CONFIRMATION, CategoryResolution.READY));
        return to(CategoryResolution.ABANDONED, category);
    }

    /** Đủ dữ liệu để tiếp tục: trạng thái còn hiệu lực, có số tiền, book, tên category (và category khi READY). */
    public boolean wellFormed() {
        if (state == null || state == CategoryResolution.ABANDONED) return false;
        if (amount == null || amount.signum() < 0) return false;
        if (book == null || !book.hasId() || categoryName == null || categoryName.isBlank()) return false;
        return state != CategoryResolution.READY || (category != null && category.hasId());
    }

    public boolean is(CategoryResolution s) {
        return state == s;
    }

    private PendingExpense to(CategoryResolution next, EntityRef cat) {
        return new PendingExpense(amount, description, paymentMethod, date, book, categoryName, cat, sourceText, next);
    }

    private void require(Set<CategoryResolution> allowed) {
        if (!allowed.contains(state)) {
            throw new IllegalStateException("Pending expense cannot leave state " + state);
        }
    }
}

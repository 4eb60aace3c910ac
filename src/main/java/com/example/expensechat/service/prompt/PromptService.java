package com.example.expensechat.service.prompt;

import com.example.expensechat.dto.ConversationMessageDto;
import com.example.expensechat.entity.Book;
import com.example.expensechat.entity.Category;
import com.example.expensechat.entity.ConversationTurn;
import com.example.expensechat.service.context.ConversationContext;
import com.example.expensechat.service.currency.CurrencyCatalog;
import com.example.expensechat.service.implement.PromptServiceImpl;
import com.example.expensechat.service.scope.UserScope;
import com.example.expensechat.service.sql.validate.SemanticValidator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PromptService implements PromptServiceImpl {

    @Override
    public List<ConversationMessageDto> build(String message, List<ConversationMessageDto> history,
                                              UserScope scope, ConversationContext context) {
        List<ConversationMessageDto> messages = new ArrayList<>();
        messages.add(ConversationMessageDto.of("system", system(scope, context)));
        messages.addAll(history);
        messages.add(ConversationMessageDto.of(ConversationTurn.ROLE_USER, message));
        return messages;
    }

    private String system(UserScope scope, ConversationContext context) {
        StringBuilder data = new StringBuilder();
        List<Book> active = scope.activeBooks();
        if (active.isEmpty()) {
            data.append("\nYOUR BOOKS: (none yet)\n");
        } else {
            data.append("\nYOUR BOOKS:\n");
            for (Book b : active) {
                data.append("- Book Name: %s, Book ID: %s, Currency: %s%n".formatted(b.getName(), b.getId(), b.getCurrency()));
            }
            data.append("\nYOUR CATEGORIES:\n");
            for (Category c : scope.categories()) {
                if (Boolean.TRUE.equals(c.getIsDisabled())) continue;
                String book = scope.bookOf(c).map(Book::getName).orElse("?");
                data.append("- Category Name: %s, Category ID: %s, Book: %s%n".formatted(c.getName(), c.getId(), book));
            }
        }
        if (context.lastBook() != null) {
            data.append("\nMOST RECENT BOOK: %s (ID %s)%n".formatted(context.lastBook().name(), context.lastBook().id()));
        }
        if (context.lastCategory() != null) {
            data.append("MOST RECENT CATEGORY: %s (ID %s)%n".formatted(context.lastCategory().name(), context.lastCategory().id()));
        }

        // Quy tắc sinh SQL: gateway vẫn kiểm tra lại toàn bộ, đây chỉ là hướng dẫn cho model
        return String.join("\n",
                "You are the assistant of \"Manage My Expenses\". You help the user manage books, categories and expenses",
                "by writing MySQL statements. The system validates and executes them and writes the confirmation itself.",
                "",
                "RULES:",
                "- Put every statement in a ```sql code block. Only INSERT, UPDATE and SELECT are allowed, one row per INSERT.",
                "- Never write success messages such as \"Successfully added\" or ✅. If you write no SQL, nothing happens.",
                "- If a required field is missing, ask for it instead of writing SQL.",
                "- Tables: books(id, userId, name, description, currency, isArchived, createdAt, updatedAt),",
                "  categories(id, bookId, name, description, icon, color, isDisabled, isDefault, createdAt, updatedAt),",
                "  expenses(id, categoryId, amount, date, description, paymentMethod, isDisabled, createdAt, updatedAt).",
                "- New book needs name and currency (" + String.join(", ", CurrencyCatalog.CODES) + ").",
                "- New category needs name and bookId (use the Book ID above).",
                "- New expense needs amount and categoryId (use the Category ID above). Defaults: date CURDATE(),",
                "  description '', paymentMethod 'Other'. Payment methods: " + String.join(", ", SemanticValidator.PAYMENT_METHODS) + ".",
                "- If the category does not exist yet, still write the INSERT with the category name in categoryId;",
                "  the system will offer to create it.",
                "- To remove something use UPDATE: expenses/categories SET isDisabled = true, books SET isArchived = true.",
                "- Always filter UPDATE statements by id.",
                "",
                "CONVERSATION CONTEXT:",
                "- If you asked a question and the user answers with a single value (\"Cash\", \"USD\"), it is the answer.",
                "- TEMPORAL REFERENCES: \"new book\", \"this book\", \"new category\", \"this category\" always mean the most",
                "  recently created item of that type. Never create a new item for these references.",
                data.toString());
    }
}

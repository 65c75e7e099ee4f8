package com.faqchat.service.conversation;

import com.faqchat.config.ChatbotConfig;
import com.faqchat.dto.internal.CitationSet;
import com.faqchat.dto.internal.MatchResult;
import com.faqchat.dto.response.CategoryOption;
import com.faqchat.dto.response.ConversationDirective;
import com.faqchat.dto.response.FaqOption;
import com.faqchat.dto.response.FormField;
import com.faqchat.dto.response.SearchResponse;
import com.faqchat.exception.ChatbotException;
import com.faqchat.exception.DatasetException;
import com.faqchat.exception.ErrorCode;
import com.faqchat.exception.NotFoundException;
import com.faqchat.exception.TransitionException;
import com.faqchat.exception.ValidationException;
import com.faqchat.model.Affordance;
import com.faqchat.model.ConversationEvent;
import com.faqchat.model.ConversationSession;
import com.faqchat.model.ConversationState;
import com.faqchat.model.InquirySubmission;
import com.faqchat.model.InteractionEvent;
import com.faqchat.model.NotificationEvent;
import com.faqchat.model.QaEntry;
import com.faqchat.service.citation.CitationService;
import com.faqchat.service.data.DataLoaderService;
import com.faqchat.service.data.DatasetSnapshot;
import com.faqchat.service.notification.NotificationSink;
import com.faqchat.service.search.SearchService;
import com.faqchat.service.session.SessionHandle;
import com.faqchat.service.session.SessionStoreService;
import com.faqchat.util.TextTruncator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives a conversation through category selection, FAQ selection and the inquiry form.
 *
 * <p>Each event is handled under the session store's per-conversation lock. A failing guard
 * never changes the state: the caller gets an {@link ConversationDirective.Type#ERROR} directive
 * instead. Notifications are sent after the lock is released.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationStateMachine {

    public static final String WELCOME_MESSAGE =
            "こんにちは！PIP-Makerについてお答えできる範囲でお答えします。\n興味があることを以下から選んでください。";
    public static final String INQUIRY_FORM_MESSAGE =
            "お問い合わせ内容をご入力ください。担当者より折り返しご連絡いたします。";
    public static final String INQUIRY_COMPLETED_MESSAGE =
            "お問合せありがとうございました！担当者からお返事いたしますので、少々お待ちください。";

    private static final Set<ConversationState> CATEGORY_SELECTABLE = EnumSet.of(
            ConversationState.INITIAL,
            ConversationState.CATEGORY_SELECTION,
            ConversationState.FAQ_SELECTION);

    private static final int PREVIEW_LENGTH = 100;

    private final SessionStoreService sessionStore;
    private final DataLoaderService dataLoaderService;
    private final SearchService searchService;
    private final CitationService citationService;
    private final InquiryValidator inquiryValidator;
    private final IdGenerator idGenerator;
    private final NotificationSink notificationSink;
    private final ChatbotConfig chatbotConfig;
    private final Clock clock;

    /**
     * Apply {@code event} to the conversation.
     *
     * @param conversationId may be null only for {@link ConversationEvent.Type#WELCOME}
     * @throws DatasetException when the Q&A dataset is unavailable
     */
    public ConversationDirective handle(String conversationId, ConversationEvent event) {
        boolean welcome = event.type() == ConversationEvent.Type.WELCOME;
        String id = conversationId;
        if (welcome && (id == null || id.isBlank())) {
            id = idGenerator.newConversationId();
        }
        if (id == null || id.isBlank()) {
            return error(null, null, NotFoundException.conversation(String.valueOf(id)));
        }
        final String key = id;

        Outcome outcome;
        try {
            outcome = sessionStore.execute(key, welcome, handle -> apply(handle, event));
        } catch (NotFoundException e) {
            log.info("Event {} for unknown conversation {}", event.type(), key);
            return error(key, null, e);
        }

        if (outcome.notification() != null) {
            try {
                notificationSink.notify(outcome.notification());
            } catch (RuntimeException e) {
                log.warn("Notification for {} not sent: {}", key, e.getMessage());
            }
        }
        return outcome.directive();
    }

    private Outcome apply(SessionHandle handle, ConversationEvent event) {
        ConversationSession session = handle.session();
        Instant now = clock.instant();
        session.touch(now);

        try {
            return switch (event.type()) {
                case WELCOME -> onWelcome(session);
                case SELECT_CATEGORY -> onSelectCategory(session, event.categoryId(), now);
                case SELECT_FAQ -> onSelectFaq(session, event.faqId(), now);
                case FREE_TEXT_QUERY -> onFreeTextQuery(session, event.query(), now);
                case START_INQUIRY -> onStartInquiry(session);
                case SUBMIT_INQUIRY -> onSubmitInquiry(session, event.formData(), now);
                case RESTART -> onRestart(handle);
            };
        } catch (TransitionException | NotFoundException | ValidationException e) {
            return new Outcome(error(session.getConversationId(), session.getState(), e), null);
        }
    }

    // ================= TRANSITIONS =================

    private Outcome onWelcome(ConversationSession session) {
        require(session, session.getState() == ConversationState.INITIAL, ConversationEvent.Type.WELCOME);

        List<CategoryOption> categories = categoryOptions(dataLoaderService.getSnapshot());
        session.setState(ConversationState.CATEGORY_SELECTION);
        log.info("Conversation {} started", session.getConversationId());

        return new Outcome(ConversationDirective.builder()
                .type(ConversationDirective.Type.CATEGORY_SELECTION)
                .conversationId(session.getConversationId())
                .state(session.getState())
                .message(WELCOME_MESSAGE)
                .categories(categories)
                .affordances(List.of(Affordance.SELECT_CATEGORY))
                .build(), null);
    }

    private Outcome onSelectCategory(ConversationSession session, String categoryId, Instant now) {
        require(session, CATEGORY_SELECTABLE.contains(session.getState()), ConversationEvent.Type.SELECT_CATEGORY);

        DatasetSnapshot snapshot = dataLoaderService.getSnapshot();
        String label = snapshot.findCategory(categoryId)
                .orElseThrow(() -> NotFoundException.category(categoryId));

        List<FaqOption> faqs = snapshot.featuredFor(label, dataLoaderService.getFaqMarker()).stream()
                .limit(chatbotConfig.getMaxFaqs())
                .map(this::toFaqOption)
                .collect(Collectors.toList());

        session.setSelectedCategory(label);
        session.setSelectedFaqId(null);
        session.setState(ConversationState.FAQ_SELECTION);

        CategoryOption option = toCategoryOption(label);
        log.info("Conversation {} selected category '{}' ({} FAQs)",
                session.getConversationId(), label, faqs.size());

        ConversationDirective directive = ConversationDirective.builder()
                .type(ConversationDirective.Type.FAQ_SELECTION)
                .conversationId(session.getConversationId())
                .state(session.getState())
                .message(option.getName() + "について、よくある質問はこちらです。")
                .selectedCategory(label)
                .faqs(faqs)
                .affordances(List.of(Affordance.START_INQUIRY))
                .build();

        InteractionEvent interaction = InteractionEvent.builder()
                .conversationId(session.getConversationId())
                .kind(InteractionEvent.Kind.CATEGORY_SELECTION)
                .category(label)
                .timestamp(now)
                .build();
        return new Outcome(directive, interaction);
    }

    private Outcome onSelectFaq(ConversationSession session, String faqId, Instant now) {
        require(session, session.getState() == ConversationState.FAQ_SELECTION, ConversationEvent.Type.SELECT_FAQ);

        QaEntry entry = parseFaqId(faqId)
                .flatMap(dataLoaderService.getSnapshot()::findById)
                .orElseThrow(() -> NotFoundException.faq(faqId));

        session.setSelectedFaqId(entry.getId());

        CitationSet citations = citationService.compose(List.of(MatchResult.builder()
                .entry(entry)
                .score(1.0)
                .matchedTerms(Set.of())
                .build()));

        ConversationDirective directive = ConversationDirective.builder()
                .type(ConversationDirective.Type.FAQ_ANSWER)
                .conversationId(session.getConversationId())
                .state(session.getState())
                .selectedCategory(session.getSelectedCategory())
                .question(entry.getQuestion())
                .answer(entry.getAnswer())
                .confidence(1.0)
                .citations(citations)
                .affordances(List.of(Affordance.MORE_QUESTIONS, Affordance.START_INQUIRY))
                .build();

        InteractionEvent interaction = InteractionEvent.builder()
                .conversationId(session.getConversationId())
                .kind(InteractionEvent.Kind.FAQ_SELECTION)
                .question(entry.getQuestion())
                .answerPreview(TextTruncator.truncate(entry.getAnswer(), PREVIEW_LENGTH))
                .confidence(1.0)
                .category(entry.getCategory())
                .timestamp(now)
                .build();
        return new Outcome(directive, interaction);
    }

    private Outcome onFreeTextQuery(ConversationSession session, String query, Instant now) {
        requireNotTerminal(session, ConversationEvent.Type.FREE_TEXT_QUERY);

        SearchResponse result = searchService.answer(query, session.getSelectedCategory());

        List<Affordance> affordances = result.isSuggestInquiry()
                ? List.of(Affordance.FEEDBACK, Affordance.START_INQUIRY)
                : List.of(Affordance.FEEDBACK);

        ConversationDirective directive = ConversationDirective.builder()
                .type(ConversationDirective.Type.SEARCH_RESULT)
                .conversationId(session.getConversationId())
                .state(session.getState())
                .selectedCategory(session.getSelectedCategory())
                .question(result.isFound() ? result.getQuestion() : query)
                .answer(result.getAnswer())
                .confidence(result.getConfidence())
                .citations(result.getCitations())
                .affordances(affordances)
                .build();

        InteractionEvent interaction = InteractionEvent.builder()
                .conversationId(session.getConversationId())
                .kind(InteractionEvent.Kind.SEARCH)
                .question(query)
                .answerPreview(TextTruncator.truncate(result.getAnswer(), PREVIEW_LENGTH))
                .confidence(result.getConfidence())
                .category(result.getCategory())
                .timestamp(now)
                .build();
        return new Outcome(directive, interaction);
    }

    private Outcome onStartInquiry(ConversationSession session) {
        requireNotTerminal(session, ConversationEvent.Type.START_INQUIRY);

        session.setState(ConversationState.INQUIRY_FORM);

        return new Outcome(ConversationDirective.builder()
                .type(ConversationDirective.Type.INQUIRY_FORM)
                .conversationId(session.getConversationId())
                .state(session.getState())
                .message(INQUIRY_FORM_MESSAGE)
                .formFields(inquiryFormFields())
                .build(), null);
    }

    private Outcome onSubmitInquiry(ConversationSession session, Map<String, String> formData, Instant now) {
        require(session, session.getState() == ConversationState.INQUIRY_FORM, ConversationEvent.Type.SUBMIT_INQUIRY);

        Map<String, String> form = inquiryValidator.validate(formData);
        String inquiryId = idGenerator.newInquiryId(session.getConversationId());

        session.setInquiryId(inquiryId);
        session.setState(ConversationState.COMPLETED);
        log.info("Inquiry {} accepted for conversation {}", inquiryId, session.getConversationId());

        ConversationDirective directive = ConversationDirective.builder()
                .type(ConversationDirective.Type.INQUIRY_RECEIPT)
                .conversationId(session.getConversationId())
                .state(session.getState())
                .message(INQUIRY_COMPLETED_MESSAGE)
                .inquiryId(inquiryId)
                .estimatedResponseTime(chatbotConfig.getEstimatedResponseTime())
                .affordances(List.of(Affordance.RESTART))
                .build();

        InquirySubmission submission = InquirySubmission.builder()
                .conversationId(session.getConversationId())
                .name(form.get(InquiryValidator.NAME))
                .company(form.get(InquiryValidator.COMPANY))
                .email(form.get(InquiryValidator.EMAIL))
                .message(form.get(InquiryValidator.INQUIRY))
                .submittedAt(now)
                .inquiryId(inquiryId)
                .build();
        return new Outcome(directive, submission);
    }

    private Outcome onRestart(SessionHandle handle) {
        List<CategoryOption> categories = categoryOptions(dataLoaderService.getSnapshot());
        ConversationSession session = handle.renew();

        return new Outcome(ConversationDirective.builder()
                .type(ConversationDirective.Type.WELCOME)
                .conversationId(session.getConversationId())
                .state(session.getState())
                .message(WELCOME_MESSAGE)
                .categories(categories)
                .affordances(List.of(Affordance.SELECT_CATEGORY))
                .build(), null);
    }

    // ================= HELPERS =================

    private static void require(ConversationSession session, boolean allowed, ConversationEvent.Type event) {
        if (!allowed) {
            throw new TransitionException(session.getState(), event);
        }
    }

    private static void requireNotTerminal(ConversationSession session, ConversationEvent.Type event) {
        require(session, !session.getState().isTerminal(), event);
    }

    private static Optional<Integer> parseFaqId(String faqId) {
        if (faqId == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(faqId.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private List<CategoryOption> categoryOptions(DatasetSnapshot snapshot) {
        return snapshot.categoryLabels().stream()
                .map(this::toCategoryOption)
                .collect(Collectors.toList());
    }

    private CategoryOption toCategoryOption(String label) {
        ChatbotConfig.CategoryDisplay display = chatbotConfig.findCategoryDisplay(label);
        if (display == null) {
            return CategoryOption.builder().id(label).name(label).build();
        }
        return CategoryOption.builder()
                .id(label)
                .name(display.getName() != null ? display.getName() : label)
                .description(display.getDescription())
                .emoji(display.getEmoji())
                .build();
    }

    private FaqOption toFaqOption(QaEntry entry) {
        return FaqOption.builder()
                .id(String.valueOf(entry.getId()))
                .question(entry.getQuestion())
                .category(entry.getCategory())
                .build();
    }

    static List<FormField> inquiryFormFields() {
        return List.of(
                field(InquiryValidator.NAME, "text"),
                field(InquiryValidator.COMPANY, "text"),
                field(InquiryValidator.EMAIL, "email"),
                field(InquiryValidator.INQUIRY, "textarea"));
    }

    private static FormField field(String name, String type) {
        return FormField.builder()
                .name(name)
                .label(InquiryValidator.labelFor(name))
                .type(type)
                .required(true)
                .build();
    }

    private static ConversationDirective error(String conversationId, ConversationState state, ChatbotException e) {
        ConversationDirective.ConversationDirectiveBuilder builder = ConversationDirective.builder()
                .type(ConversationDirective.Type.ERROR)
                .conversationId(conversationId)
                .state(state)
                .errorCode(e.getErrorCode());

        if (e instanceof ValidationException validation) {
            builder.message("入力内容をご確認ください。")
                    .fieldErrors(validation.getFieldErrors());
        } else if (e.getErrorCode() == ErrorCode.NOT_FOUND) {
            builder.message("指定された項目が見つかりませんでした。");
        } else {
            log.debug("Rejected transition for {}: {}", conversationId, e.getMessage());
            builder.message("この操作は現在の画面では行えません。");
            builder.affordances(List.of(Affordance.RESTART));
        }
        return builder.build();
    }

    private record Outcome(ConversationDirective directive, NotificationEvent notification) {
    }
}

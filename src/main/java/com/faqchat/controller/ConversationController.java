package com.faqchat.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.faqchat.dto.request.CategorySelectionRequest;
import com.faqchat.dto.request.ConversationQueryRequest;
import com.faqchat.dto.request.ConversationRequest;
import com.faqchat.dto.request.FaqSelectionRequest;
import com.faqchat.dto.request.InquiryRequest;
import com.faqchat.dto.response.ConversationDirective;
import com.faqchat.dto.response.SessionView;
import com.faqchat.exception.NotFoundException;
import com.faqchat.model.ConversationEvent;
import com.faqchat.service.conversation.ConversationStateMachine;
import com.faqchat.service.session.SessionStoreService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/conversation")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationStateMachine stateMachine;
    private final SessionStoreService sessionStore;

    @GetMapping("/welcome")
    public ResponseEntity<ConversationDirective> welcome(
            @RequestParam(name = "conversationId", required = false) String conversationId) {
        return respond(stateMachine.handle(conversationId, ConversationEvent.welcome()));
    }

    @PostMapping("/category")
    public ResponseEntity<ConversationDirective> selectCategory(@Valid @RequestBody CategorySelectionRequest request) {
        return respond(stateMachine.handle(request.getConversationId(),
                ConversationEvent.selectCategory(request.getCategoryId())));
    }

    @PostMapping("/faq")
    public ResponseEntity<ConversationDirective> selectFaq(@Valid @RequestBody FaqSelectionRequest request) {
        return respond(stateMachine.handle(request.getConversationId(),
                ConversationEvent.selectFaq(request.getFaqId())));
    }

    @PostMapping("/query")
    public ResponseEntity<ConversationDirective> query(@Valid @RequestBody ConversationQueryRequest request) {
        log.info("Conversation {} query: {}", request.getConversationId(), request.getQuestion());
        return respond(stateMachine.handle(request.getConversationId(),
                ConversationEvent.freeTextQuery(request.getQuestion())));
    }

    @PostMapping("/inquiry/start")
    public ResponseEntity<ConversationDirective> startInquiry(@Valid @RequestBody ConversationRequest request) {
        return respond(stateMachine.handle(request.getConversationId(), ConversationEvent.startInquiry()));
    }

    @PostMapping("/inquiry")
    public ResponseEntity<ConversationDirective> submitInquiry(@Valid @RequestBody InquiryRequest request) {
        return respond(stateMachine.handle(request.getConversationId(),
                ConversationEvent.submitInquiry(request.getFormData())));
    }

    @PostMapping("/restart")
    public ResponseEntity<ConversationDirective> restart(@Valid @RequestBody ConversationRequest request) {
        return respond(stateMachine.handle(request.getConversationId(), ConversationEvent.restart()));
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<SessionView> session(@PathVariable String conversationId) {
        return sessionStore.find(conversationId)
                .map(SessionView::of)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> NotFoundException.conversation(conversationId));
    }

    static HttpStatus statusOf(ConversationDirective directive) {
        if (!directive.isError() || directive.getErrorCode() == null) {
            return HttpStatus.OK;
        }
        return switch (directive.getErrorCode()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case TRANSITION_NOT_ALLOWED -> HttpStatus.CONFLICT;
            case VALIDATION_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case DATASET_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case GENERAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ConversationDirective> respond(ConversationDirective directive) {
        return ResponseEntity.status(statusOf(directive)).body(directive);
    }
}

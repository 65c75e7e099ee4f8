package com.faqchat.controller;

import com.faqchat.dto.request.FeedbackRequest;
import com.faqchat.exception.DatasetException;
import com.faqchat.exception.GlobalExceptionHandler;
import com.faqchat.model.Rating;
import com.faqchat.service.data.DataLoaderService;
import com.faqchat.service.feedback.FeedbackService;
import com.faqchat.service.search.SearchService;
import com.faqchat.service.session.SessionStoreService;
import com.faqchat.support.TestFixtures.ConversationStack;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ChatControllerTest {

    private final ConversationStack stack = new ConversationStack();
    private final FeedbackService feedbackService = mock(FeedbackService.class);

    @Test
    void searchReturnsAnswerWithCitations() throws Exception {
        MockMvc mvc = mvc(stack.searchService, stack.dataLoader);

        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"PIP-Makerとは何ですか？\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.category").value("general"))
                .andExpect(jsonPath("$.suggestInquiry").value(false))
                .andExpect(jsonPath("$.citations.showing").isNumber());
    }

    @Test
    void searchWithoutDatasetIs503WithErrorId() throws Exception {
        SearchService failing = mock(SearchService.class);
        when(failing.search(any())).thenThrow(DatasetException.notLoaded());
        MockMvc mvc = mvc(failing, stack.dataLoader);

        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"料金\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorId").value(org.hamcrest.Matchers.matchesPattern("ERR_[0-9A-F]{8}")))
                .andExpect(jsonPath("$.fallbackMessage").exists())
                .andExpect(content().string(org.hamcrest.Matchers.not(
                        org.hamcrest.Matchers.containsString("not loaded"))));
    }

    @Test
    void emptyQuestionReturnsNoMatchAnswer() throws Exception {
        mvc(stack.searchService, stack.dataLoader).perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(false))
                .andExpect(jsonPath("$.confidence").value(0.0))
                .andExpect(jsonPath("$.suggestInquiry").value(true))
                .andExpect(jsonPath("$.citations.showing").value(0));
    }

    @Test
    void overlongQuestionIs400() throws Exception {
        mvc(stack.searchService, stack.dataLoader).perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"" + "あ".repeat(1001) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.question").exists());
    }

    @Test
    void feedbackIsAcceptedWithoutBody() throws Exception {
        mvc(stack.searchService, stack.dataLoader).perform(post("/api/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"c1\",\"rating\":\"negative\",\"comment\":\"違う\"}"))
                .andExpect(status().isAccepted())
                .andExpect(content().string(""));

        ArgumentCaptor<FeedbackRequest> captor = ArgumentCaptor.forClass(FeedbackRequest.class);
        verify(feedbackService).submit(captor.capture());
        assertThat(captor.getValue().getRating()).isEqualTo(Rating.NEGATIVE);
    }

    @Test
    void unknownRatingIs400() throws Exception {
        mvc(stack.searchService, stack.dataLoader).perform(post("/api/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"c1\",\"rating\":\"meh\"}"))
                .andExpect(status().isBadRequest());

        verify(feedbackService, never()).submit(any());
    }

    @Test
    void healthReportsDatasetAndSessions() throws Exception {
        mvc(stack.searchService, stack.dataLoader).perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.dataset.entries").value(5))
                .andExpect(jsonPath("$.active_sessions").value(0));
    }

    private MockMvc mvc(SearchService searchService, DataLoaderService dataLoader) {
        SessionStoreService sessions = stack.sessionStore;
        return MockMvcBuilders.standaloneSetup(new ChatController(searchService, feedbackService, dataLoader, sessions))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }
}

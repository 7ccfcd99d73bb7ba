package com.example.jobrunner.service.handler;

import com.example.jobrunner.client.EdgeFunctionClient;
import com.example.jobrunner.domain.entity.AutomatedTask;
import com.example.jobrunner.domain.enums.TaskStatus;
import com.example.jobrunner.domain.enums.TaskType;
import com.example.jobrunner.exception.ExternalServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MarketingCampaignHandler Tests")
class MarketingCampaignHandlerTest {

    @Mock
    private EdgeFunctionClient edgeFunctionClient;

    @InjectMocks
    private MarketingCampaignHandler handler;

    @Captor
    private ArgumentCaptor<Map<String, Object>> requestCaptor;

    private static AutomatedTask buildTask(Map<String, Object> metadata) {
        return AutomatedTask.builder()
                .id(UUID.fromString("5f0c7a4e-8d3b-4f1e-9a61-2b7c3d4e5f60"))
                .taskType("marketing_campaign")
                .status(TaskStatus.RUNNING)
                .metadata(new HashMap<>(metadata))
                .build();
    }

    @Test
    @DisplayName("Should return MARKETING_CAMPAIGN task type")
    void shouldReturnCorrectTaskType() {
        assertThat(handler.getTaskType()).isEqualTo(TaskType.MARKETING_CAMPAIGN);
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Should pass validation with templateName")
        void shouldPassValidation() {
            var task = buildTask(Map.of("templateName", "spring_sale"));

            assertThatCode(() -> handler.validate(task)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should reject task without templateName")
        void shouldRejectMissingTemplate() {
            var task = buildTask(Map.of("targetSegment", "vip"));

            assertThatThrownBy(() -> handler.validate(task))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("templateName");
        }
    }

    @Nested
    @DisplayName("Execution Tests")
    class ExecutionTests {

        @Test
        @DisplayName("Should call marketing-campaign-manager with metadata and defaults")
        void shouldBuildRequest() {
            // Given
            var task = buildTask(Map.of("templateName", "spring_sale"));
            when(edgeFunctionClient.invoke(eq("marketing-campaign-manager"), any())).thenReturn(Map.of("sent", 42));

            // When
            var result = handler.execute(task);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getResponseData()).containsEntry("sent", 42);
            verify(edgeFunctionClient).invoke(eq("marketing-campaign-manager"), requestCaptor.capture());
            assertThat(requestCaptor.getValue())
                    .containsEntry("action", "execute_campaign")
                    .containsEntry("templateName", "spring_sale")
                    .containsEntry("targetSegment", "all")
                    .containsEntry("task_type", "marketing_campaign")
                    .containsEntry("task_id", "5f0c7a4e-8d3b-4f1e-9a61-2b7c3d4e5f60");
        }

        @Test
        @DisplayName("Should keep requested target segment")
        void shouldKeepTargetSegment() {
            var task = buildTask(Map.of("templateName", "spring_sale", "targetSegment", "inactive_30d"));
            when(edgeFunctionClient.invoke(eq("marketing-campaign-manager"), any())).thenReturn(Map.of());

            handler.execute(task);

            verify(edgeFunctionClient).invoke(eq("marketing-campaign-manager"), requestCaptor.capture());
            assertThat(requestCaptor.getValue()).containsEntry("targetSegment", "inactive_30d");
        }

        @Test
        @DisplayName("Should return HTTP failure on error status")
        void shouldReturnHttpFailure() {
            var task = buildTask(Map.of("templateName", "spring_sale"));
            when(edgeFunctionClient.invoke(eq("marketing-campaign-manager"), any()))
                    .thenThrow(new ExternalServiceException("Edge Functions", 422, "unknown template"));

            var result = handler.execute(task);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getHttpStatusCode()).isEqualTo(422);
            assertThat(result.getErrorMessage()).contains("unknown template");
        }

        @Test
        @DisplayName("Should return failure on network error")
        void shouldReturnNetworkFailure() {
            var task = buildTask(Map.of("templateName", "spring_sale"));
            when(edgeFunctionClient.invoke(eq("marketing-campaign-manager"), any()))
                    .thenThrow(new ExternalServiceException("Edge Functions", new ConnectException("Connection refused")));

            var result = handler.execute(task);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getHttpStatusCode()).isNull();
            assertThat(result.getErrorType()).isEqualTo("ExternalServiceException");
        }
    }
}

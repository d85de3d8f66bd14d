package com.studioledger.backup.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    @DisplayName("should handle ApiException with correct status and message")
    void shouldHandleApiException() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleApiException(new ApiException("Backup not found", HttpStatus.NOT_FOUND));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("message", "Backup not found");
        assertThat(response.getBody()).containsEntry("status", 404);
        assertThat(response.getBody()).containsKey("timestamp");
    }

    @Test
    @DisplayName("should list field errors of an invalid body")
    void shouldHandleValidationException() {
        BindingResult bindingResult = mock(BindingResult.class);
        when(bindingResult.getAllErrors()).thenReturn(List.of(new FieldError("request", "name", "Name is required")));

        ResponseEntity<Map<String, Object>> response =
                handler.handleValidationException(new MethodArgumentNotValidException(null, bindingResult));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        @SuppressWarnings("unchecked")
        Map<String, String> errors = (Map<String, String>) response.getBody().get("errors");
        assertThat(errors).containsEntry("name", "Name is required");
    }

    @Test
    @DisplayName("should map storage errors to BAD_GATEWAY")
    void shouldHandleStorageProviderException() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleStorageProviderException(new StorageProviderException("bucket not found"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody()).containsEntry("message", "Storage provider error: bucket not found");
    }

    @Test
    @DisplayName("should map corrupt archives to UNPROCESSABLE_ENTITY")
    void shouldHandleArchiveFormatException() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleArchiveFormatException(new ArchiveFormatException("manifest.json missing"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody()).containsEntry("message", "Invalid backup archive: manifest.json missing");
    }

    @Test
    @DisplayName("should hide database tool output")
    void shouldHandleDatabaseCommandException() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleDatabaseCommandException(new DatabaseCommandException("psql: FATAL password authentication failed"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("message", "Database command failed");
    }

    @Test
    @DisplayName("should map IllegalArgumentException to BAD_REQUEST")
    void shouldHandleIllegalArgument() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleIllegalArgumentException(new IllegalArgumentException("Unsupported provider: ftp"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("message", "Unsupported provider: ftp");
    }

    @Test
    @DisplayName("should map IllegalStateException to CONFLICT")
    void shouldHandleIllegalState() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleIllegalStateException(new IllegalStateException("Backup is still running"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    @DisplayName("should not leak details of unexpected errors")
    void shouldHandleGenericException() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleGenericException(new RuntimeException("NullPointer somewhere"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("message", "An unexpected error occurred");
    }
}

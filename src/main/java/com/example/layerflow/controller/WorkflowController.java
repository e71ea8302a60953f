package com.example.layerflow.controller;

import com.example.layerflow.model.ExecutionResult;
import com.example.layerflow.request.FactCheckRequest;
import com.example.layerflow.response.WorkflowResponse;
import com.example.layerflow.service.FactCheckWorkflowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1/workflow")
@Tag(name = "Workflow API", description = "Three-layer fact-check pipeline")
@RequiredArgsConstructor
public class WorkflowController {

    private final FactCheckWorkflowService workflowService;

    @PostMapping("/fact-check")
    @Operation(
            summary = "Fact-check an answer",
            description = "Runs auditor, critic and reviser with validated hand-offs. "
                    + "Returns 200 when the run completes and 422 with the abort reason otherwise."
    )
    public Mono<ResponseEntity<WorkflowResponse>> factCheck(@Valid @RequestBody FactCheckRequest req) {
        return workflowService.factCheck(req)
                .map(result -> {
                    WorkflowResponse body = toResponse(result, workflowService.backendOf(req));
                    return result.isCompleted()
                            ? ResponseEntity.ok(body)
                            : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
                })
                .onErrorResume(IllegalArgumentException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(errorResponse(ex.getMessage()))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while running fact-check workflow", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(toUnexpectedErrorResponse(ex)));
                });
    }

    @GetMapping("/adapters/{backend}")
    @Operation(summary = "Describe a remote agent backend", description = "Configured endpoints and supported operations.")
    public Mono<ResponseEntity<Map<String, Object>>> adapterInfo(@PathVariable String backend) {
        return Mono.fromCallable(() -> workflowService.adapterInfo(backend))
                .map(ResponseEntity::ok)
                .onErrorResume(IllegalArgumentException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()))));
    }

    private WorkflowResponse toResponse(ExecutionResult result, String backend) {
        Map<String, Object> output = result.getFinalOutput();
        Object finalText = output == null ? null : output.get("final_output");
        return WorkflowResponse.builder()
                .correlationId(result.getCorrelationId())
                .backend(backend)
                .status(result.getStatus().name())
                .abortReason(result.getAbortReason())
                .failureDetail(result.getFailureDetail())
                .finalOutput(finalText == null ? null : String.valueOf(finalText))
                .qualityScore(result.getQualityScore())
                .output(output)
                .stages(result.getExecutionLog())
                .validationTrail(result.getValidationTrail())
                .totalDurationMs(result.getTotalDuration() == null ? null : result.getTotalDuration().toMillis())
                .errors(result.isCompleted() ? List.of() : List.of(result.getAbortReason() + ": " + result.getFailureDetail()))
                .build();
    }

    private WorkflowResponse errorResponse(String message) {
        return WorkflowResponse.builder()
                .errors(List.of(message == null ? "Bad request." : message))
                .build();
    }

    private WorkflowResponse toUnexpectedErrorResponse(Throwable ex) {
        String detail = ex.getMessage();
        String message = (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
        return WorkflowResponse.builder()
                .errors(List.of(message))
                .build();
    }
}

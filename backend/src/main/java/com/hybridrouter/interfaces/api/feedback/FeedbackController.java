package com.hybridrouter.interfaces.api.feedback;

import com.hybridrouter.application.feedback.CostReconciliation;
import com.hybridrouter.application.feedback.FeedbackAppService;
import com.hybridrouter.application.feedback.IngestResult;
import com.hybridrouter.interfaces.api.dto.CostReportRequest;
import com.hybridrouter.interfaces.api.dto.CostReportResponse;
import com.hybridrouter.interfaces.api.dto.FeedbackRequest;
import com.hybridrouter.interfaces.api.dto.FeedbackResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackAppService feedbackAppService;

    @PostMapping("/feedback")
    public ResponseEntity<FeedbackResponse> ingest(@Valid @RequestBody FeedbackRequest request) {
        IngestResult result = feedbackAppService.ingest(
                request.contentId(),
                request.source(),
                request.payload().toString(),
                request.occurredAt());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new FeedbackResponse(result.accepted(), result.duplicate()));
    }

    @PostMapping("/costs")
    public ResponseEntity<CostReportResponse> reportCost(@Valid @RequestBody CostReportRequest request) {
        CostReconciliation result = feedbackAppService.reportCost(request.contentId(), request.amount());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(CostReportResponse.from(result));
    }
}

package com.hybridrouter.interfaces.api.admin;

import com.hybridrouter.application.admin.AdminAppService;
import com.hybridrouter.application.learning.LearningCycleReport;
import com.hybridrouter.application.learning.LearningCycleService;
import com.hybridrouter.domain.policy.model.ExplorationPolicy;
import com.hybridrouter.interfaces.api.dto.BanditStatsResponse;
import com.hybridrouter.interfaces.api.dto.BudgetPolicyRequest;
import com.hybridrouter.interfaces.api.dto.BudgetPolicyResponse;
import com.hybridrouter.interfaces.api.dto.RuleTableResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminAppService adminAppService;
    private final LearningCycleService learningCycleService;

    @GetMapping("/bandit")
    public ResponseEntity<BanditStatsResponse> bandit() {
        ExplorationPolicy policy = adminAppService.explorationPolicy();
        return ResponseEntity.ok(new BanditStatsResponse(
                adminAppService.banditVersion(),
                adminAppService.providerStatistics(),
                policy.mode(),
                policy.reason(),
                policy.since(),
                adminAppService.decisionCounts()));
    }

    @PostMapping("/rules/reload")
    public ResponseEntity<RuleTableResponse> reloadRules() {
        return ResponseEntity.ok(RuleTableResponse.from(adminAppService.reloadRules()));
    }

    @PutMapping("/budget")
    public ResponseEntity<BudgetPolicyResponse> updateBudget(@Valid @RequestBody BudgetPolicyRequest request) {
        return ResponseEntity.ok(BudgetPolicyResponse.from(adminAppService.updateBudget(
                request.monthlyCap(), request.softRatio(), request.hardRatio())));
    }

    @PostMapping("/learning-cycle")
    public ResponseEntity<LearningCycleReport> runLearningCycle() {
        return ResponseEntity.ok(learningCycleService.runCycle());
    }
}

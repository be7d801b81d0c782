package com.hybridrouter.application.routing;

import com.hybridrouter.domain.budget.model.BudgetDirective;
import com.hybridrouter.domain.routing.model.RequestContext;
import com.hybridrouter.domain.routing.model.RoutingDecision;
import com.hybridrouter.infrastructure.budget.BudgetCalibrator;
import com.hybridrouter.infrastructure.routing.RoutingEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RoutingAppService {

    private final RoutingEngine routingEngine;
    private final BudgetCalibrator calibrator;

    public RoutingDecision route(String contentId, String language, String category, double complexity, double risk) {
        return routingEngine.route(new RequestContext(contentId, language, category, complexity, risk));
    }

    public BudgetDirective directive() {
        return calibrator.directive();
    }
}

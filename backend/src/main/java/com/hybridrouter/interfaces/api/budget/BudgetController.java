package com.hybridrouter.interfaces.api.budget;

import com.hybridrouter.application.routing.RoutingAppService;
import com.hybridrouter.interfaces.api.dto.DirectiveResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/budget")
@RequiredArgsConstructor
public class BudgetController {

    private final RoutingAppService routingAppService;

    @GetMapping("/directive")
    public ResponseEntity<DirectiveResponse> directive() {
        return ResponseEntity.ok(DirectiveResponse.from(routingAppService.directive()));
    }
}

package com.hybridrouter.interfaces.api.routing;

import com.hybridrouter.application.routing.RoutingAppService;
import com.hybridrouter.domain.routing.model.RoutingDecision;
import com.hybridrouter.interfaces.api.dto.RouteRequest;
import com.hybridrouter.interfaces.api.dto.RouteResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/route")
@RequiredArgsConstructor
public class RoutingController {

    private final RoutingAppService routingAppService;

    @PostMapping
    public ResponseEntity<RouteResponse> route(@Valid @RequestBody RouteRequest request) {
        RoutingDecision decision = routingAppService.route(
                request.contentId(),
                request.language(),
                request.category(),
                request.complexity(),
                request.risk());

        return ResponseEntity.ok(RouteResponse.from(decision));
    }
}

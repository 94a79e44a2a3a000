package mail.taxonomy.app.controller;

import mail.taxonomy.app.model.RoutingTable;
import mail.taxonomy.app.service.RoutingTableService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Routing table consumed by the workflow engine when it deploys a tenant's classifier.
 */
@RestController
public class RoutingTableController {
    private final RoutingTableService routingTableService;

    public RoutingTableController(RoutingTableService routingTableService) {
        this.routingTableService = routingTableService;
    }

    @GetMapping("/api/tenants/{tenantId}/routing-table")
    public ResponseEntity<?> buildRoutingTable(@PathVariable String tenantId) {
        try {
            RoutingTable table = routingTableService.buildRoutingTable(tenantId);
            return ResponseEntity.ok(table);
        } catch (Exception e) {
            return ApiErrorResponses.from(tenantId, e);
        }
    }
}

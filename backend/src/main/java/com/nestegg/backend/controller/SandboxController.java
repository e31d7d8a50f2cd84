package com.nestegg.backend.controller;

import com.nestegg.backend.dto.CreateSandboxRequest;
import com.nestegg.backend.dto.PortfolioResponse;
import com.nestegg.backend.dto.SandboxSummaryDTO;
import com.nestegg.backend.dto.TradeRequest;
import com.nestegg.backend.dto.TradeResponse;
import com.nestegg.backend.dto.TransactionDTO;
import com.nestegg.backend.exception.UnauthorizedException;
import com.nestegg.backend.security.UserPrincipal;
import com.nestegg.backend.service.SandboxService;
import com.nestegg.backend.service.TradeExecutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sandboxes")
@RequiredArgsConstructor
@Tag(name = "Sandboxes")
public class SandboxController {

    private final SandboxService sandboxService;
    private final TradeExecutionService tradeExecutionService;

    @GetMapping
    @Operation(summary = "List the caller's own sandboxes with current equity")
    public ResponseEntity<List<SandboxSummaryDTO>> listSandboxes(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(sandboxService.listSandboxes(requireUserId(principal)));
    }

    @GetMapping("/shared")
    @Operation(summary = "List sandboxes other users have shared with the caller")
    public ResponseEntity<List<SandboxSummaryDTO>> listShared(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(sandboxService.listShared(requireUserId(principal)));
    }

    @PostMapping
    @Operation(summary = "Create a sandbox")
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = SandboxSummaryDTO.class)))
    public ResponseEntity<SandboxSummaryDTO> createSandbox(@AuthenticationPrincipal UserPrincipal principal,
                                                           @Valid @RequestBody CreateSandboxRequest request) {
        SandboxSummaryDTO created = sandboxService.createSandbox(requireUserId(principal), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a sandbox with its lots, transactions and snapshots (owner only)")
    @ApiResponse(responseCode = "204", content = @Content)
    public ResponseEntity<Void> deleteSandbox(@AuthenticationPrincipal UserPrincipal principal,
                                              @PathVariable Long id) {
        sandboxService.deleteSandbox(requireUserId(principal), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/portfolio")
    @Operation(summary = "Lots valued at live prices, cash, total equity and the daily equity curve")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = PortfolioResponse.class)))
    public ResponseEntity<PortfolioResponse> getPortfolio(@AuthenticationPrincipal UserPrincipal principal,
                                                          @PathVariable Long id) {
        return ResponseEntity.ok(sandboxService.getPortfolio(requireUserId(principal), id));
    }

    @GetMapping("/{id}/transactions")
    @Operation(summary = "Executed trades, newest first")
    public ResponseEntity<List<TransactionDTO>> getTransactions(@AuthenticationPrincipal UserPrincipal principal,
                                                                @PathVariable Long id) {
        return ResponseEntity.ok(sandboxService.getTransactions(requireUserId(principal), id));
    }

    @PostMapping("/{id}/trade")
    @Operation(summary = "Buy or sell at the current market price")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = TradeResponse.class)))
    public ResponseEntity<TradeResponse> trade(@AuthenticationPrincipal UserPrincipal principal,
                                               @PathVariable Long id,
                                               @Valid @RequestBody TradeRequest request) {
        return ResponseEntity.ok(tradeExecutionService.execute(id, requireUserId(principal), request));
    }

    private Long requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}

package com.chanakya.vault.controller;

import com.chanakya.vault.model.dto.request.CreateGrantRequest;
import com.chanakya.vault.model.dto.response.AccessLogEntry;
import com.chanakya.vault.model.dto.response.GrantResponse;
import com.chanakya.vault.service.AccessGrantService;
import com.chanakya.vault.service.AccessLogService;
import com.chanakya.vault.service.QrCodeService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

// TODO: take ownerId from the authenticated principal once OAuth2 login is wired in
@RestController
@RequestMapping("/api/patients/{ownerId}")
public class GrantController {

    private final AccessGrantService grantService;
    private final AccessLogService accessLogService;
    private final QrCodeService qrCodeService;

    public GrantController(AccessGrantService grantService,
                           AccessLogService accessLogService,
                           QrCodeService qrCodeService) {
        this.grantService = grantService;
        this.accessLogService = accessLogService;
        this.qrCodeService = qrCodeService;
    }

    /**
     * Issue a time-bound grant over the selected reports.
     */
    @PostMapping("/grants")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<GrantResponse> issueGrant(@PathVariable String ownerId,
                                          @Valid @RequestBody CreateGrantRequest request) {
        Duration ttl = request.ttlMinutes() != null ? Duration.ofMinutes(request.ttlMinutes()) : null;
        return grantService.issue(ownerId, request.reportIds(), ttl)
                .map(grantService::toResponse);
    }

    /**
     * Grants not yet revoked, including expired ones so they can be cleaned up.
     */
    @GetMapping("/grants")
    public Flux<GrantResponse> listGrants(@PathVariable String ownerId) {
        return grantService.listActive(ownerId).map(grantService::toResponse);
    }

    @PostMapping("/grants/{grantId}/revoke")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> revokeGrant(@PathVariable String ownerId, @PathVariable String grantId) {
        return grantService.revoke(ownerId, grantId).then();
    }

    @GetMapping(value = "/grants/{grantId}/qr", produces = MediaType.IMAGE_PNG_VALUE)
    public Mono<byte[]> getQrCode(@PathVariable String ownerId, @PathVariable String grantId) {
        return grantService.findOwned(ownerId, grantId)
                .flatMap(grant -> qrCodeService.generateQrCode(grantService.shareUrl(grant), QrCodeService.DEFAULT_SIZE));
    }

    @GetMapping("/grants/{grantId}/access-log")
    public Flux<AccessLogEntry> getGrantAccessLog(@PathVariable String ownerId, @PathVariable String grantId) {
        return accessLogService.listForGrant(ownerId, grantId);
    }

    @GetMapping("/access-log")
    public Flux<AccessLogEntry> getAccessLog(@PathVariable String ownerId) {
        return accessLogService.listForOwner(ownerId);
    }
}

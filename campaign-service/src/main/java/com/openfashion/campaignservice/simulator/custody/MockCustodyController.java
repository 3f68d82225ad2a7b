package com.openfashion.campaignservice.simulator.custody;

import com.openfashion.campaignservice.client.custody.dto.CustodyTransferRequest;
import com.openfashion.campaignservice.client.custody.dto.CustodyTransferResponse;
import com.openfashion.campaignservice.client.custody.dto.CustodyTransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stands in for the custody service in local runs. Approves every well-formed
 * movement and answers repeated references from its idempotency store.
 */
@Slf4j
@RestController
@RequestMapping("/mock-custody")
@Profile("dev")
public class MockCustodyController {

    private final Map<String, Settlement> idempotencyStore = new ConcurrentHashMap<>();

    @PostMapping("/native/payouts")
    public CustodyTransferResponse nativePayout(@RequestBody CustodyTransferRequest request) {
        return settle("native payout", request);
    }

    @PostMapping("/tokens/{tokenId}/transfers")
    public CustodyTransferResponse tokenTransfer(@PathVariable String tokenId, @RequestBody CustodyTransferRequest request) {
        return settle(tokenId + " transfer", request);
    }

    @PostMapping("/tokens/{tokenId}/pulls")
    public CustodyTransferResponse tokenPull(@PathVariable String tokenId, @RequestBody CustodyTransferRequest request) {
        return settle(tokenId + " pull", request);
    }

    private CustodyTransferResponse settle(String kind, CustodyTransferRequest request) {
        Settlement settled = idempotencyStore.get(request.referenceId());
        if (settled != null) {
            if (!settled.matches(request)) {
                log.warn("Mock Custody: reference {} reused with different terms", request.referenceId());
                return new CustodyTransferResponse(UUID.randomUUID(), CustodyTransferStatus.DECLINED, "REFERENCE_CONFLICT");
            }
            log.info("Mock Custody: returning cached response for {}", request.referenceId());
            return settled.response();
        }

        if (request.accountId() == null || request.amount() == null || request.amount().signum() <= 0) {
            log.info("Mock Custody: {} for {} declined", kind, request.accountId());
            return new CustodyTransferResponse(UUID.randomUUID(), CustodyTransferStatus.DECLINED, "INVALID_REQUEST");
        }

        CustodyTransferResponse response = new CustodyTransferResponse(UUID.randomUUID(), CustodyTransferStatus.APPROVED, "SUCCESS");
        log.info("Mock Custody: {} of {} for {} -> {}", kind, request.amount(), request.accountId(), response.status());
        idempotencyStore.put(request.referenceId(), new Settlement(request, response));
        return response;
    }

    // Only approved movements are remembered; a declined reference may be sent again
    private record Settlement(CustodyTransferRequest request, CustodyTransferResponse response) {
        boolean matches(CustodyTransferRequest other) {
            return request.accountId().equals(other.accountId())
                    && other.amount() != null
                    && request.amount().compareTo(other.amount()) == 0;
        }
    }
}

package com.openfashion.campaignservice.client.custody;

import com.openfashion.campaignservice.client.custody.strategy.AssetTransferStrategy;
import com.openfashion.campaignservice.model.AssetType;
import com.openfashion.campaignservice.model.FundingAsset;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class CustodyClient implements ValueTransferGateway {

    private final List<AssetTransferStrategy> strategies;

    private final Map<AssetType, AssetTransferStrategy> strategyMap = new EnumMap<>(AssetType.class);

    @PostConstruct
    public void initStrategies() {
        for (AssetType type : AssetType.values()) {
            strategies.stream()
                    .filter(s -> s.supports(type))
                    .findFirst()
                    .ifPresentOrElse(
                            s -> strategyMap.put(type, s),
                            () -> log.warn("No transfer strategy found for AssetType: {}", type)
                    );
        }
    }

    @Override
    public TransferResult transfer(FundingAsset asset, UUID recipient, BigDecimal amount, String reference) {
        log.info("Transferring {} {} to {} ({})", amount, asset, recipient, reference);
        return strategyFor(asset).transfer(asset, recipient, amount, reference);
    }

    @Override
    public TransferResult pull(FundingAsset asset, UUID from, BigDecimal amount, String reference) {
        log.info("Pulling {} {} from {} ({})", amount, asset, from, reference);
        return strategyFor(asset).pull(asset, from, amount, reference);
    }

    private AssetTransferStrategy strategyFor(FundingAsset asset) {
        AssetTransferStrategy strategy = strategyMap.get(asset.getType());
        if (strategy == null) {
            throw new UnsupportedOperationException("No transfer strategy for asset: " + asset);
        }
        return strategy;
    }
}

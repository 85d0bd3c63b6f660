package uk.gegc.clubaccess.features.subscription.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.clubaccess.features.ledger.domain.model.Subscription;
import uk.gegc.clubaccess.features.subscription.api.dto.SubscriptionView;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriptionMapper {

    SubscriptionView toView(Subscription subscription);
}

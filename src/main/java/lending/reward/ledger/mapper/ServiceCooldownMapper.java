package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.ServiceCooldown;
import lending.reward.ledger.enums.ServiceType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface ServiceCooldownMapper {
    ServiceCooldown find(@Param("userId") Long userId, @Param("serviceType") ServiceType serviceType);

    void insert(ServiceCooldown cooldown);

    void update(ServiceCooldown cooldown);
}

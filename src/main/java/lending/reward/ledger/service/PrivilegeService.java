package lending.reward.ledger.service;

import lending.reward.ledger.domain.ConsumptionRecord;
import lending.reward.ledger.domain.UserPrivilege;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lending.reward.ledger.mapper.ConsumptionRecordMapper;
import lending.reward.ledger.service.telemetry.TelemetryPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Derives user privileges from the unexpired consumption history.
 * The history is the only stored state; the packed form is produced for telemetry and reads.
 */
@Slf4j
@Service
public class PrivilegeService {

    @Autowired
    private ConsumptionRecordMapper recordMapper;

    @Autowired
    private TelemetryPublisher telemetry;

    @Autowired
    private Clock clock;

    public UserPrivilege getUserPrivilege(Long userId) {
        return computePrivilege(userId, clock.instant().getEpochSecond());
    }

    /**
     * Highest active level per service type at the given time
     */
    public UserPrivilege computePrivilege(Long userId, long now) {
        List<ConsumptionRecord> active = recordMapper.findActiveByUserId(userId, now);
        UserPrivilege privilege = UserPrivilege.none(userId);
        for (ConsumptionRecord record : active) {
            privilege.grant(record.getServiceType(), record.getServiceLevel());
        }
        return privilege;
    }

    /**
     * Level currently held for a service type, null without access
     */
    public ServiceLevel activeLevel(Long userId, ServiceType serviceType, long now) {
        return computePrivilege(userId, now).levelOf(serviceType);
    }

    /**
     * Recompute after a purchase and mirror the packed summary
     */
    public UserPrivilege refresh(Long userId, long now) {
        UserPrivilege privilege = computePrivilege(userId, now);
        long packed = privilege.pack();
        log.debug("Privilege recomputed: userId={}, packed={}", userId, packed);
        telemetry.privilegeChanged(userId, packed);
        return privilege;
    }
}

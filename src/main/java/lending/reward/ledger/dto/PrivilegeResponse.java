package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lending.reward.ledger.domain.UserPrivilege;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Current service privileges of a user")
public class PrivilegeResponse {

    private UserPrivilege privilege;

    @Schema(description = "Packed summary: access bits 0-4, 3-bit level codes from bit 5")
    private Long packed;

    public static PrivilegeResponse fromPrivilege(UserPrivilege privilege) {
        return PrivilegeResponse.builder()
                .privilege(privilege)
                .packed(privilege.pack())
                .build();
    }
}

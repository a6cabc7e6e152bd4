package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.UserAccount;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * MyBatis mapper for UserAccount operations
 */
@Mapper
public interface UserAccountMapper {
    /**
     * Insert a new account
     */
    void insert(UserAccount account);

    /**
     * Find account by user ID
     */
    UserAccount findByUserId(@Param("userId") Long userId);

    /**
     * Write back all mutable columns of an account
     */
    void update(UserAccount account);
}

package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.OrderLock;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;
import java.util.List;

/**
 * MyBatis mapper for per-order point locks
 */
@Mapper
public interface OrderLockMapper {
    void insert(OrderLock lock);

    OrderLock findByOrderId(@Param("orderId") Long orderId);

    List<OrderLock> findByBorrower(@Param("borrower") Long borrower);

    /**
     * Sum of points locked across all live orders of a borrower
     */
    BigInteger sumLockedByBorrower(@Param("borrower") Long borrower);

    /**
     * Delete a lock, returns the number of rows removed
     */
    int deleteByOrderId(@Param("orderId") Long orderId);
}

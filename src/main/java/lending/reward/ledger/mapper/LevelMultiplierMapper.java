package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.LevelMultiplier;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface LevelMultiplierMapper {
    LevelMultiplier findByLevel(@Param("tierLevel") Integer tierLevel);

    List<LevelMultiplier> findAll();

    void insert(LevelMultiplier multiplier);

    void update(LevelMultiplier multiplier);
}

package com.headspace.infrastructure.dao;

import com.headspace.infrastructure.dao.po.TurnPO;
import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnIntentEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 回合 DAO。
 */
@Mapper
public interface TurnDao {

    int insert(TurnPO po);

    TurnPO selectById(@Param("id") Long id);

    List<TurnPO> selectLatestByAgentId(@Param("agentId") Long agentId, @Param("limit") Integer limit);

    List<TurnPO> selectRecentByAgentId(@Param("agentId") Long agentId, @Param("cutoff") LocalDateTime cutoff);

    List<TurnPO> selectAllByAgentId(@Param("agentId") Long agentId);

    int updateTimestamp(@Param("id") Long id,
                        @Param("eventTime") LocalDateTime eventTime,
                        @Param("timestampSource") TimestampSourceEnum timestampSource,
                        @Param("entryFingerprint") String entryFingerprint);

    int updateIntent(@Param("id") Long id, @Param("intent") TurnIntentEnum intent);
}

package com.headspace.infrastructure.dao;

import com.headspace.infrastructure.dao.po.MonitorEventPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 监控事件 DAO。
 */
@Mapper
public interface MonitorEventDao {

    int insert(MonitorEventPO po);

    List<MonitorEventPO> selectByAgentIdAfterEventId(@Param("agentId") Long agentId,
                                                     @Param("afterEventId") Long afterEventId,
                                                     @Param("limit") Integer limit);
}

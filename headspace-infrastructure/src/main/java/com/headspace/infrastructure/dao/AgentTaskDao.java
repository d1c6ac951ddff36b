package com.headspace.infrastructure.dao;

import com.headspace.infrastructure.dao.po.AgentTaskPO;
import com.headspace.types.enums.TaskStateEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agent 任务 DAO。
 */
@Mapper
public interface AgentTaskDao {

    int insert(AgentTaskPO po);

    AgentTaskPO selectById(@Param("id") Long id);

    AgentTaskPO selectActiveByAgentId(@Param("agentId") Long agentId);

    AgentTaskPO selectLatestByAgentId(@Param("agentId") Long agentId);

    List<AgentTaskPO> selectByAgentId(@Param("agentId") Long agentId);

    int updateStateIfMatch(@Param("id") Long id,
                           @Param("expectedState") TaskStateEnum expectedState,
                           @Param("targetState") TaskStateEnum targetState,
                           @Param("completionReason") String completionReason,
                           @Param("completedAt") LocalDateTime completedAt);
}

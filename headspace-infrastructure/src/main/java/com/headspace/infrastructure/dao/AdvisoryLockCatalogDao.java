package com.headspace.infrastructure.dao;

import com.headspace.infrastructure.dao.po.HeldAdvisoryLockPO;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

/**
 * pg_locks / pg_stat_activity 只读查询 DAO。
 */
@Mapper
public interface AdvisoryLockCatalogDao {

    List<HeldAdvisoryLockPO> selectAdvisoryLocks();
}

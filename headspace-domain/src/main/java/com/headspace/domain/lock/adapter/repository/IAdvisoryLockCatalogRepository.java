package com.headspace.domain.lock.adapter.repository;

import com.headspace.domain.lock.model.valobj.HeldAdvisoryLockVO;

import java.util.List;

/**
 * 数据库 advisory lock 视图查询（监控用）。
 */
public interface IAdvisoryLockCatalogRepository {

    List<HeldAdvisoryLockVO> findHeldLocks();
}

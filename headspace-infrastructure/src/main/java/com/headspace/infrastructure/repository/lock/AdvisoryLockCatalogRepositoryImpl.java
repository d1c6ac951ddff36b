package com.headspace.infrastructure.repository.lock;

import com.headspace.domain.lock.adapter.repository.IAdvisoryLockCatalogRepository;
import com.headspace.domain.lock.model.valobj.HeldAdvisoryLockVO;
import com.headspace.infrastructure.dao.AdvisoryLockCatalogDao;
import com.headspace.infrastructure.dao.po.HeldAdvisoryLockPO;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Advisory lock 视图查询实现。
 */
@Repository
public class AdvisoryLockCatalogRepositoryImpl implements IAdvisoryLockCatalogRepository {

    private static final long OID_RANGE = 1L << 32;

    private final AdvisoryLockCatalogDao advisoryLockCatalogDao;

    public AdvisoryLockCatalogRepositoryImpl(AdvisoryLockCatalogDao advisoryLockCatalogDao) {
        this.advisoryLockCatalogDao = advisoryLockCatalogDao;
    }

    @Override
    public List<HeldAdvisoryLockVO> findHeldLocks() {
        List<HeldAdvisoryLockPO> list = advisoryLockCatalogDao.selectAdvisoryLocks();
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toValueObject).collect(Collectors.toList());
    }

    private HeldAdvisoryLockVO toValueObject(HeldAdvisoryLockPO po) {
        return HeldAdvisoryLockVO.builder()
                .pid(po.getPid())
                .applicationName(po.getApplicationName())
                .backendState(po.getBackendState())
                .namespace(po.getNamespace())
                .entityId(toSignedKey(po.getEntityId()))
                .mode(po.getMode())
                .granted(po.getGranted())
                .queryStart(po.getQueryStart())
                .durationSeconds(po.getDurationSeconds())
                .build();
    }

    // objid is an unsigned oid; the int4 key it came from may be negative
    private Long toSignedKey(Long objid) {
        if (objid == null) {
            return null;
        }
        return objid > Integer.MAX_VALUE ? objid - OID_RANGE : objid;
    }
}

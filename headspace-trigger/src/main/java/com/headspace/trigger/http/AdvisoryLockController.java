package com.headspace.trigger.http;

import com.headspace.api.dto.AdvisoryLockDTO;
import com.headspace.api.response.Response;
import com.headspace.domain.lock.adapter.repository.IAdvisoryLockCatalogRepository;
import com.headspace.domain.lock.model.valobj.HeldAdvisoryLockVO;
import com.headspace.types.enums.LockNamespaceEnum;
import com.headspace.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 当前持有与等待中的 advisory lock 一览。
 */
@RestController
@RequestMapping("/api/advisory-locks")
public class AdvisoryLockController {

    private final IAdvisoryLockCatalogRepository advisoryLockCatalogRepository;

    public AdvisoryLockController(IAdvisoryLockCatalogRepository advisoryLockCatalogRepository) {
        this.advisoryLockCatalogRepository = advisoryLockCatalogRepository;
    }

    @GetMapping
    public Response<List<AdvisoryLockDTO>> listLocks() {
        List<HeldAdvisoryLockVO> locks = advisoryLockCatalogRepository.findHeldLocks();
        List<AdvisoryLockDTO> result = new ArrayList<>(locks.size());
        for (HeldAdvisoryLockVO lock : locks) {
            AdvisoryLockDTO dto = new AdvisoryLockDTO();
            dto.setPid(lock.getPid());
            dto.setApplicationName(lock.getApplicationName());
            dto.setBackendState(lock.getBackendState());
            dto.setNamespace(resolveNamespace(lock.getNamespace()));
            dto.setEntityId(lock.getEntityId());
            dto.setMode(lock.getMode());
            dto.setGranted(lock.getGranted());
            dto.setQueryStart(lock.getQueryStart());
            dto.setDurationSeconds(lock.getDurationSeconds());
            result.add(dto);
        }
        return Response.<List<AdvisoryLockDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(result)
                .build();
    }

    private String resolveNamespace(Integer code) {
        if (code == null) {
            return null;
        }
        LockNamespaceEnum namespace = LockNamespaceEnum.fromCode(code);
        return namespace == null ? String.valueOf(code) : namespace.name();
    }
}

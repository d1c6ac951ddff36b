package com.headspace.domain.lock.adapter.gateway;

/**
 * Advisory lock 后端端口：每次打开一个专用会话（独立于业务事务所用的连接）。
 */
public interface IAdvisoryLockBackend {

    IAdvisoryLockSession openSession();
}

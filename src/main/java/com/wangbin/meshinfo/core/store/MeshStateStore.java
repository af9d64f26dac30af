package com.wangbin.meshinfo.core.store;

import com.wangbin.meshinfo.common.domain.entity.Link;
import com.wangbin.meshinfo.common.domain.entity.Node;
import com.wangbin.meshinfo.common.domain.entity.PollRun;
import com.wangbin.meshinfo.common.exception.PersistenceException;

import java.util.Collection;

/**
 * 采集结果的持久化出口
 */
public interface MeshStateStore {

    void saveNetwork(Collection<Node> nodes, Collection<Link> links) throws PersistenceException;

    void saveRun(PollRun run) throws PersistenceException;
}

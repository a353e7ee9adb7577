/**
 * 端口分配器接口
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.service;

import com.vdiscovery.common.model.PortAllocation;
import com.vdiscovery.common.model.PortAssignment;
import com.vdiscovery.common.model.PortRange;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 端口分配器接口
 * 按服务类型把端口划分到互不相交的范围内，保证并发分配不冲突
 */
public interface PortAllocator {

    /**
     * 在提示的范围内分配最小的空闲端口
     *
     * @param serviceName 服务名称
     * @param rangeHint 范围名称，为空时使用默认范围
     * @return 分配到的端口；服务已持有同一范围内的端口时返回已有端口
     */
    int allocate(String serviceName, String rangeHint);

    /**
     * 与allocate相同，但在同一把锁内给出端口是否为本次新分配
     *
     * 服务已持有的端口不在目标范围内时，会在目标范围内重新分配并释放旧端口
     *
     * @param serviceName 服务名称
     * @param rangeHint 范围名称，为空时使用默认范围
     * @return 分配结果
     */
    PortAssignment assign(String serviceName, String rangeHint);

    /**
     * 在显式给定的范围内分配端口
     *
     * @param serviceName 服务名称
     * @param low 起始端口（含）
     * @param high 结束端口（含）
     * @return 分配到的端口
     */
    int allocateInRange(String serviceName, int low, int high);

    /**
     * 释放端口，对未分配的端口是空操作
     *
     * @param port 端口号
     */
    void release(int port);

    /**
     * 释放服务持有的端口
     *
     * @param serviceName 服务名称
     * @return 确实释放了端口返回true
     */
    boolean releaseServicePort(String serviceName);

    /**
     * 查询端口是否可分配（只看分配记录，不检查操作系统绑定）
     *
     * @param port 端口号
     * @return 可分配返回true
     */
    boolean isPortAvailable(int port);

    Optional<Integer> getPortForService(String serviceName);

    Optional<PortAllocation> getAllocation(int port);

    /**
     * 当前所有分配的快照
     *
     * @return 按端口排序的分配列表
     */
    List<PortAllocation> listAllocations();

    /**
     * 运行时新增或替换命名范围，已有分配不受影响
     *
     * @param rangeName 范围名称
     * @param range 端口范围
     */
    void setPortRange(String rangeName, PortRange range);

    /**
     * @return 当前命名范围的快照，包含默认范围
     */
    Map<String, PortRange> getPortRanges();

    /**
     * 运行时追加保留端口，已分配出去的端口不会被收回
     *
     * @param port 端口号
     */
    void addReservedPort(int port);

    void removeReservedPort(int port);

    /**
     * @return 保留端口的有序快照
     */
    Set<Integer> getReservedPorts();

    void addConfigListener(AllocatorConfigListener listener);

    /**
     * 分配器运行时配置变更监听
     */
    interface AllocatorConfigListener {

        default void onPortRangeChanged(String rangeName, PortRange oldRange, PortRange newRange) {
        }

        default void onReservedPortsChanged(Set<Integer> reservedPorts) {
        }
    }
}

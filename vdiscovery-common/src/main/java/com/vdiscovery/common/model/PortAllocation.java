/**
 * 端口分配记录
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 已占用端口的分配信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortAllocation {

    /**
     * 端口号
     */
    private int port;

    /**
     * 占用该端口的服务名
     */
    private String serviceName;

    /**
     * 端口所属的范围名称
     */
    private String rangeName;

    /**
     * 分配时间
     */
    private Instant allocatedAt;
}

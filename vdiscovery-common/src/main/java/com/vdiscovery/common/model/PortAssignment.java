/**
 * 端口分配结果
 *
 * @author zhenglin
 * @date 2025/09/09
 */
package com.vdiscovery.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次分配调用的结果，区分新分配的端口和服务已持有的端口
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortAssignment {

    private int port;

    private String rangeName;

    /**
     * 本次调用新占用了端口时为true；服务原本持有且继续沿用时为false
     */
    private boolean fresh;

    /**
     * 因范围变化被替换掉的旧端口，没有时为0
     */
    private int previousPort;
}

/**
 * 端口范围
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 闭区间端口范围 [low, high]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PortRange {

    public static final int MIN_PORT = 1;
    public static final int MAX_PORT = 65535;

    /**
     * 起始端口（含）
     */
    private int low;

    /**
     * 结束端口（含）
     */
    private int high;

    public static PortRange of(int low, int high) {
        return new PortRange(low, high);
    }

    public boolean contains(int port) {
        return port >= low && port <= high;
    }

    public int size() {
        return high - low + 1;
    }

    /**
     * 校验范围是否合法
     *
     * @return 1 <= low <= high <= 65535 时返回true
     */
    public boolean isValid() {
        return low >= MIN_PORT && high <= MAX_PORT && low <= high;
    }

    @Override
    public String toString() {
        return "[" + low + "," + high + "]";
    }
}

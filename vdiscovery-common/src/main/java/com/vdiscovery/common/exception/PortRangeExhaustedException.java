/**
 * 端口耗尽异常
 *
 * @author zhenglin
 * @date 2025/09/02
 */
package com.vdiscovery.common.exception;

import com.vdiscovery.common.model.PortRange;

/**
 * 指定端口范围内没有空闲端口时抛出，属于可恢复的正常情况
 */
public class PortRangeExhaustedException extends DiscoveryException {

    private static final long serialVersionUID = 1L;

    private final String rangeName;

    private final PortRange range;

    public PortRangeExhaustedException(String rangeName, PortRange range) {
        super("no ports available in range " + rangeName + " " + range);
        this.rangeName = rangeName;
        this.range = range;
    }

    public String getRangeName() {
        return rangeName;
    }

    public PortRange getRange() {
        return range;
    }
}

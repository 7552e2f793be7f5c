package com.work.exchange.core.support;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.UUID;

/**
 * nodeId 是 orderbook 锁 owner 的前缀（owner = nodeId + ":" + threadId）。
 * <p>优先使用配置值；未配置时取 hostname 加随机后缀，保证同机多实例也不会互相释放锁。</p>
 */
public class SimpleNodeIdProvider implements NodeIdProvider {

    private final String nodeId;

    public SimpleNodeIdProvider() {
        this(null);
    }

    /**
     * @param configured 可为空；其中的 ':' 会被替换，避免与 owner 分隔符冲突
     */
    public SimpleNodeIdProvider(String configured) {
        String base = configured == null || configured.trim().isEmpty() ? defaultNodeId() : configured.trim();
        this.nodeId = base.replace(':', '-').toLowerCase(Locale.ROOT);
    }

    @Override
    public String getNodeId() {
        return nodeId;
    }

    private static String defaultNodeId() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + suffix;
        } catch (UnknownHostException e) {
            return "exchange-" + suffix;
        }
    }
}

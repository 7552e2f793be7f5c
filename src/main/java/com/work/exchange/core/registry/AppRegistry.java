package com.work.exchange.core.registry;

import com.work.exchange.core.model.AppInfo;

/**
 * app 注册表：app 名称 → owner 身份。orderbook 只把它当作只读的授权依据。
 */
public interface AppRegistry {

    /**
     * 注册 app，名称已存在时失败。
     */
    AppInfo register(String name, String owner);

    boolean exists(String name);

    /**
     * @throws com.work.exchange.core.exception.RegistryException app 不存在
     */
    AppInfo get(String name);

    boolean isOwner(String name, String identity);
}

package org.csits.reportd.manager.remote;

import java.io.IOException;

/**
 * 远端 API 调用失败（网络、鉴权、非 2xx 响应或响应无法解析）。
 */
public class RemoteJobException extends IOException {

    public RemoteJobException(String message) {
        super(message);
    }

    public RemoteJobException(String message, Throwable cause) {
        super(message, cause);
    }
}

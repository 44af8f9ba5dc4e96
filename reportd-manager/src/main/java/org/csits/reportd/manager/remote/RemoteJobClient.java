package org.csits.reportd.manager.remote;

/**
 * 远端设备管理 API 的导出作业接口。
 */
public interface RemoteJobClient {

    /**
     * 创建导出作业。
     *
     * @return 远端作业 ID
     */
    String createExportJob(ExportJobRequest request) throws RemoteJobException;

    ExportJobStatus getExportJobStatus(String jobId) throws RemoteJobException;

    /**
     * 下载已完成作业的归档内容。
     *
     * @param downloadHandle 作业完成时返回的下载地址
     */
    byte[] downloadExportJobData(String downloadHandle) throws RemoteJobException;
}

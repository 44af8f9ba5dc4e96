package org.csits.reportd.dao;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 报表定义仓储，支持文件和内存两种实现。单写者：只有执行协调器和配置入口写入。
 */
public interface ScheduledReportRepository {

    /**
     * 读取所有可解析的报表定义，损坏的文件被跳过。
     *
     * @throws IOException 存储目录不可读
     */
    List<ScheduledReportEntity> findAll() throws IOException;

    Optional<ScheduledReportEntity> findById(String id) throws IOException;

    /**
     * 保存到报表的来源文件，新报表为 {id}.json。
     */
    void save(ScheduledReportEntity report) throws IOException;

    /**
     * 在写锁内重新读取报表、应用修改并保存，避免覆盖其他写入者的改动。
     *
     * @return 修改后的报表；报表已不存在时为空且不写入
     */
    Optional<ScheduledReportEntity> update(String id, Consumer<ScheduledReportEntity> change) throws IOException;

    /**
     * 按前端给定的文件名原样保存报表定义，内容必须能解析为报表。
     *
     * @throws IllegalArgumentException 文件名非法或内容无法解析
     */
    ScheduledReportEntity saveConfiguration(String fileName, byte[] content) throws IOException;

    /**
     * @return 文件是否存在并已删除
     */
    boolean delete(String fileName) throws IOException;

    Optional<ScheduledReportIndex> readIndex() throws IOException;

    void writeIndex(ScheduledReportIndex index) throws IOException;

    /**
     * 原样保存前端提交的索引，内容必须能解析为索引。
     */
    ScheduledReportIndex saveIndex(byte[] content) throws IOException;
}

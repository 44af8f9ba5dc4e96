package org.csits.reportd.manager.archive;

/**
 * 导出归档解包。
 */
public interface ArchiveExtractor {

    /**
     * 解包归档并返回期望格式的数据文件。
     *
     * @param archiveBytes 远端导出作业下载得到的 zip 内容
     * @param expectedFormat 期望格式（csv / json）
     * @return 选中的数据文件
     * @throws ArchiveExtractionException 归档不可读，或不含任何 csv/json 文件
     */
    ExtractedPayload extract(byte[] archiveBytes, String expectedFormat) throws ArchiveExtractionException;
}

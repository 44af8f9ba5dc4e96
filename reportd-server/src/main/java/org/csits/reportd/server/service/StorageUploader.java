package org.csits.reportd.server.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.reportd.dao.DeliveryConfig;
import org.csits.reportd.dao.ScheduledReportEntity;
import org.csits.reportd.manager.archive.ExtractedPayload;
import org.csits.reportd.manager.storage.StorageClient;
import org.csits.reportd.manager.storage.StorageConfiguration;
import org.csits.reportd.manager.storage.StorageException;
import org.csits.reportd.manager.storage.UnknownStorageConfigurationException;
import org.csits.reportd.server.constants.ExportFormat;
import org.csits.reportd.server.dto.UploadResult;
import org.springframework.stereotype.Service;

/**
 * 将报表数据上传到报表指定的命名存储配置，按需生成限时下载链接。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageUploader {

    private final ServiceConfigService serviceConfigService;
    private final StorageClient storageClient;
    private final FileNamingService fileNamingService;
    private final Clock clock;

    /**
     * @throws UnknownStorageConfigurationException 存储配置名不存在
     * @throws StorageException 上传或链接生成失败
     */
    public UploadResult upload(ScheduledReportEntity report, ExtractedPayload payload, String jobId)
        throws StorageException {
        DeliveryConfig delivery = report.getDelivery() != null ? report.getDelivery() : new DeliveryConfig();
        String configName = delivery.getStorageConfigName();
        StorageConfiguration configuration = serviceConfigService.findStorageConfiguration(configName)
            .orElseThrow(() -> new UnknownStorageConfigurationException(configName));

        LocalDateTime now = LocalDateTime.now(clock);
        ExportFormat format = ExportFormat.fromValue(report.getFormat());
        String folder = fileNamingService.resolveFolderPath(delivery.getFolderPath(), report.getReportType(), now);
        String fileName = fileNamingService.resolveFileName(delivery.getFileNameTemplate(), report.getName(),
            report.getReportType(), jobId, format.getExtension(), now);
        String objectName = folder + fileName;

        log.info("[reportId={}] 上传报表: storage={}, object={}, size={}", report.getId(), configName, objectName,
            payload.size());
        storageClient.upload(configuration, objectName, payload.getContent(), format.getContentType());

        UploadResult.UploadResultBuilder result = UploadResult.builder()
            .storageConfigName(configName)
            .objectName(objectName)
            .fileName(fileName)
            .fileSize(payload.size());
        if (delivery.isCreateShareableLink()) {
            int days = delivery.getLinkExpirationDays() != null && delivery.getLinkExpirationDays() > 0
                ? delivery.getLinkExpirationDays() : DeliveryConfig.DEFAULT_LINK_EXPIRATION_DAYS;
            String link = storageClient.generateDownloadLink(configuration, objectName, Duration.ofDays(days));
            log.info("[reportId={}] 已生成下载链接，有效期 {} 天", report.getId(), days);
            result.downloadLink(link).linkExpirationDays(days);
        }
        return result.build();
    }
}

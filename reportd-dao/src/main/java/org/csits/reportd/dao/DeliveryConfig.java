package org.csits.reportd.dao;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 报表投递配置。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeliveryConfig {

    public static final String DEFAULT_FOLDER_PATH = "reports/{reportType}/";
    public static final String DEFAULT_FILE_NAME_TEMPLATE = "{reportName}_{date}_{time}.{extension}";
    public static final int DEFAULT_LINK_EXPIRATION_DAYS = 7;

    @JsonAlias("azureStorageConfigName")
    private String storageConfigName = "";

    private String folderPath = DEFAULT_FOLDER_PATH;

    private String fileNameTemplate = DEFAULT_FILE_NAME_TEMPLATE;

    private boolean createShareableLink;

    private Integer linkExpirationDays = DEFAULT_LINK_EXPIRATION_DAYS;
}

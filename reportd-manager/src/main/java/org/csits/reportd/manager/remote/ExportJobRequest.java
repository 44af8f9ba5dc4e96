package org.csits.reportd.manager.remote;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportJobRequest {

    private String reportType;

    /**
     * OData 过滤表达式，为空表示不过滤。
     */
    private String filter;

    /**
     * 为空表示全部列。
     */
    private List<String> columns;

    private String format;
}

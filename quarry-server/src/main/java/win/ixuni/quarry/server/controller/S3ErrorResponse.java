package win.ixuni.quarry.server.controller;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * S3 标准错误响应
 *
 * <pre>
 * &lt;Error&gt;
 *     &lt;Code&gt;NoSuchKey&lt;/Code&gt;
 *     &lt;Message&gt;The specified key does not exist.&lt;/Message&gt;
 *     &lt;Key&gt;test-object.txt&lt;/Key&gt;
 *     &lt;Resource&gt;/test-bucket/test-object.txt&lt;/Resource&gt;
 *     &lt;RequestId&gt;4442587FB7D0A2F9&lt;/RequestId&gt;
 * &lt;/Error&gt;
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"Code", "Message"})
@JacksonXmlRootElement(localName = "Error")
public class S3ErrorResponse {

    @JacksonXmlProperty(localName = "Code")
    private String code;

    @JacksonXmlProperty(localName = "Message")
    private String message;

    /**
     * Error-specific elements such as Key, BucketName or ActualObjectSize
     */
    @Builder.Default
    private Map<String, String> details = new LinkedHashMap<>();

    @JacksonXmlProperty(localName = "Resource")
    private String resource;

    @JacksonXmlProperty(localName = "RequestId")
    private String requestId;

    @JsonAnyGetter
    public Map<String, String> getDetails() {
        return details;
    }
}

package com.impetus.impetus_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.impetus.impetus_backend.model.domain.Node;
import lombok.Builder;

import java.util.Collections;
import java.util.List;

/**
 * A block entry. Missing values read back as the model defaults, so sparse documents
 * (hand-written or from the S-expression form, which omits defaults) map cleanly.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeDto(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("x") Double x,
    @JsonProperty("y") Double y,
    @JsonProperty("w") Double w,
    @JsonProperty("h") Double h,
    @JsonProperty("isProxy") Boolean isProxy,
    @JsonProperty("proxyIsInlet") Boolean proxyIsInlet,
    @JsonProperty("proxyIndex") Integer proxyIndex,
    @JsonProperty("type") String type,
    @JsonProperty("isPermanent") Boolean isPermanent,
    @JsonProperty("constValue") String constValue,
    @JsonProperty("marshallerOutputType") String marshallerOutputType,
    @JsonProperty("inputs") List<PortDefDto> inputs,
    @JsonProperty("outputs") List<PortDefDto> outputs,
    @JsonProperty("inner") LayoutGraphDto inner
) {
    public static final String DEFAULT_TYPE = "Regular";

    public String id() {
        return id != null ? id : "";
    }

    public String title() {
        return title != null ? title : "";
    }

    public Double x() {
        return x != null ? x : 0.0;
    }

    public Double y() {
        return y != null ? y : 0.0;
    }

    public Double w() {
        return w != null ? w : Node.DEFAULT_WIDTH;
    }

    public Double h() {
        return h != null ? h : Node.DEFAULT_HEIGHT;
    }

    public Boolean isProxy() {
        return Boolean.TRUE.equals(isProxy);
    }

    public Boolean proxyIsInlet() {
        return Boolean.TRUE.equals(proxyIsInlet);
    }

    public Integer proxyIndex() {
        return proxyIndex != null ? proxyIndex : 0;
    }

    public String type() {
        return type != null ? type : DEFAULT_TYPE;
    }

    public Boolean isPermanent() {
        return Boolean.TRUE.equals(isPermanent);
    }

    public String constValue() {
        return constValue != null ? constValue : Node.DEFAULT_CONST_VALUE;
    }

    public List<PortDefDto> inputs() {
        return inputs != null ? inputs : Collections.emptyList();
    }

    public List<PortDefDto> outputs() {
        return outputs != null ? outputs : Collections.emptyList();
    }
}

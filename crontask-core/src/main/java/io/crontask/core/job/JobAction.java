package io.crontask.core.job;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a job does when it fires. The set of variants is closed; the {@code type} tag is persisted with
 * every job and execution record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HttpCallAction.class, name = "http")
})
public sealed interface JobAction permits HttpCallAction {
}

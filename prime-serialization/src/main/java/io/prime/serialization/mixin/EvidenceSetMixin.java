package io.prime.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.prime.core.evidence.EvidenceItem;
import java.util.List;

/// Jackson mixin binding `EvidenceSet` to its public constructor.
///
/// Serialized shape: `{"subject_id":"...","items":[...]}`, `subject_id` omitted when null.
/// Items use the module's `EvidenceItem` serializer pair.
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class EvidenceSetMixin {

    @JsonCreator
    EvidenceSetMixin(
            @JsonProperty("subject_id") String subjectId,
            @JsonProperty("items") List<EvidenceItem> items) {}

    @JsonProperty("subject_id")
    abstract String getSubjectId();

    @JsonProperty("items")
    abstract List<EvidenceItem> getItems();

    @JsonIgnore
    abstract boolean isEmpty();
}

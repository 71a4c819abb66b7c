package dtm.strata.exceptions;

import dtm.strata.prototypes.Tag;
import lombok.Getter;

import java.util.Set;
import java.util.stream.Collectors;

@Getter
public class UnsatisfiedLayerException extends DependencyContainerException{
    private final String layerName;
    private final Set<Tag<?>> tags;

    public UnsatisfiedLayerException(String message, String layerName, Set<Tag<?>> tags){
        super(message + " [layer: " + layerName + "] -> " + tags.stream()
                .map(Tag::getId)
                .collect(Collectors.joining(", ")));
        this.layerName = layerName;
        this.tags = Set.copyOf(tags);
    }
}

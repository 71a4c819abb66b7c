package dtm.strata.storage;

import dtm.strata.prototypes.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cadeia imutável dos tags em criação em um caminho de resolução.
 * <p>
 * Cada factory recebe a cadeia do seu próprio caminho, então duas resoluções
 * independentes que compartilham um mesmo tag não são confundidas com um ciclo.
 */
public final class ResolutionChain {

    private static final ResolutionChain EMPTY = new ResolutionChain(List.of());

    private final List<Tag<?>> tags;

    private ResolutionChain(List<Tag<?>> tags) {
        this.tags = tags;
    }

    public static ResolutionChain empty(){
        return EMPTY;
    }

    public boolean contains(Tag<?> tag){
        for (Tag<?> current : tags) {
            if (current == tag) return true;
        }
        return false;
    }

    public ResolutionChain append(Tag<?> tag){
        List<Tag<?>> next = new ArrayList<>(tags.size() + 1);
        next.addAll(tags);
        next.add(tag);
        return new ResolutionChain(Collections.unmodifiableList(next));
    }

    public List<Tag<?>> getTags(){
        return tags;
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}

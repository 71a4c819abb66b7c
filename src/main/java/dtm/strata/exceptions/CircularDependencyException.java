package dtm.strata.exceptions;

import dtm.strata.prototypes.Tag;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lançada quando uma factory solicita, direta ou indiretamente, o tag que ela mesma está criando.
 * <p>
 * {@link #getChain()} contém, em ordem, os tags em criação no caminho em que o ciclo foi
 * encontrado; {@link #getTag()} é o tag solicitado novamente.
 */
@Getter
public class CircularDependencyException extends DependencyContainerException{
    private final Tag<?> tag;
    private final List<Tag<?>> chain;

    public CircularDependencyException(Tag<?> tag, List<Tag<?>> chain){
        super("Dependência circular detectada para " + tag.getId() + ": " + render(tag, chain));
        this.tag = tag;
        this.chain = List.copyOf(chain);
    }

    public List<String> getChainIds(){
        return chain.stream().map(Tag::getId).collect(Collectors.toList());
    }

    private static String render(Tag<?> tag, List<Tag<?>> chain){
        return chain.stream()
                .map(Tag::getId)
                .collect(Collectors.joining(" -> ")) + " -> " + tag.getId();
    }
}

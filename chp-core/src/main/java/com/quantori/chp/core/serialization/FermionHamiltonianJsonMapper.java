package com.quantori.chp.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.chp.api.hamiltonian.FermionHamiltonian;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import lombok.experimental.UtilityClass;

/**
 * Writes fermion Hamiltonians as JSON. Terms keep the Hamiltonian's insertion order, so converting
 * the same source twice produces the same text.
 */
@UtilityClass
public final class FermionHamiltonianJsonMapper {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static String toJsonString(FermionHamiltonian hamiltonian) throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(toDocument(hamiltonian));
  }

  public static FermionHamiltonianDocument toDocument(FermionHamiltonian hamiltonian) {
    Map<String, List<FermionHamiltonianDocument.TermDocument>> terms = new LinkedHashMap<>();
    hamiltonian.getTerms().forEach((type, typedTerms) -> {
      List<FermionHamiltonianDocument.TermDocument> documents = new ArrayList<>(typedTerms.size());
      typedTerms.forEach((term, coefficient) ->
          documents.add(new FermionHamiltonianDocument.TermDocument(
              IntStream.of(term.getIndices()).boxed().toList(), coefficient)));
      terms.put(type.getLabel(), documents);
    });
    return new FermionHamiltonianDocument(List.copyOf(hamiltonian.getSystemIndices()), terms);
  }
}

package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.util.LinkedHashMap;
import java.util.List;

/** One CONTRACT citation per contract record, keyed by contract id. */
final class ContractRule implements SynthesisRule {

  @Override
  public String name() {
    return "contract";
  }

  @Override
  public List<Citation> candidates(LedgerSnapshot snapshot, SynthesisContext context) {
    return context.contracts().stream()
        .filter(contract -> contract.getId() != null)
        .map(
            contract -> {
              String contractId = contract.getId().toString();
              String number = contract.getContractNumber();
              boolean numbered = number != null && !number.isBlank();
              String label = numbered ? number : contractId;
              var metadata = new LinkedHashMap<String, Object>();
              metadata.put("contract_id", contractId);
              if (numbered) {
                metadata.put("contract_number", number);
              }
              if (contract.getStatus() != null) {
                metadata.put("status", contract.getStatus());
              }
              if (contract.getClientName() != null) {
                metadata.put("client_name", contract.getClientName());
              }
              if (contract.getTotalAmount() != null) {
                metadata.put("total_amount", contract.getTotalAmount());
              }
              return SyntheticCitations.create(
                  CiteType.CONTRACT,
                  contractId,
                  "Contract #" + label,
                  label,
                  metadata,
                  context.now());
            })
        .toList();
  }
}

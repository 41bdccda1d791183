package dtm.servicekit.exceptions;

import dtm.servicekit.prototypes.ServiceType;
import lombok.Getter;

/**
 * Lançada por {@code getRequired} quando nenhum descritor atende ao contrato solicitado.
 * Indica erro de programação no ponto de chamada; não deve ser tratada como falha recuperável.
 */
@Getter
public class MissingRequiredServiceException extends ServiceContainerException{
    private final ServiceType<?> contract;

    public MissingRequiredServiceException(ServiceType<?> contract){
        super("Nenhum serviço registrado para o contrato obrigatório: " + contract.getName());
        this.contract = contract;
    }
}

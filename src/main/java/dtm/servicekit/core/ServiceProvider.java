package dtm.servicekit.core;

import dtm.servicekit.prototypes.ConcurrencyMode;
import dtm.servicekit.prototypes.ServiceDescriptor;

import java.util.List;

/**
 * Provider produzido por um build bem-sucedido. Dono do cache de singletons e,
 * usado diretamente, do seu próprio escopo raiz para serviços scoped.
 */
public interface ServiceProvider extends ServiceResolver {

    /**
     * Retorna os descritores validados, na ordem de registro.
     *
     * @return lista imutável de descritores
     */
    List<ServiceDescriptor> getDescriptors();

    ConcurrencyMode getConcurrencyMode();
}

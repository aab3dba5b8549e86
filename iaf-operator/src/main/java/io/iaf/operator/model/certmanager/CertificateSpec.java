package io.iaf.operator.model.certmanager;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CertificateSpec {
    private String secretName;
    private List<String> dnsNames;
    private IssuerRef issuerRef;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IssuerRef {
        private String name;
        private String kind;
    }
}

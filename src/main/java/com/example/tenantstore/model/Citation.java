package com.example.tenantstore.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Citation {
    private String type;
    private String reference;
    private String url;
    private Boolean verified;
}

package com.vedant.securequery.service;

import com.vedant.securequery.dto.SecuredStatement;
import com.vedant.securequery.exception.SecurityViolationException;
import com.vedant.securequery.util.FilterInjector;
import com.vedant.securequery.util.SecurityGate;
import com.vedant.securequery.util.TenantCodeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns untrusted generator output into a tenant-filtered, parameterized statement.
 * <p>
 * Order: tenant code validation, gate on the raw text, filter injection, gate on the rewritten
 * text, then a check that every tenant-scoped reference carries its predicate. Each step throws
 * {@link SecurityViolationException}; nothing is executed here.
 */
@Service
public class SecureQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(SecureQueryBuilder.class);

    public SecuredStatement build(String rawSql, String tenantCode) {
        TenantCodeValidator.validate(tenantCode);

        SecurityGate.check(rawSql);

        SecuredStatement secured = FilterInjector.inject(rawSql, tenantCode);

        SecurityGate.check(secured.sqlText());
        SecurityGate.verifyTenantFilter(secured, tenantCode);

        log.debug("Secured statement with {} tenant parameter(s): {}", secured.parameters().size(), secured.sqlText());
        return secured;
    }
}

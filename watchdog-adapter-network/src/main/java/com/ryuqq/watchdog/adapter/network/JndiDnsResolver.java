package com.ryuqq.watchdog.adapter.network;

import com.ryuqq.watchdog.core.spi.DnsResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;

/**
 * JNDI DNS provider 기반 resolver.
 *
 * <p>시스템 resolver를 거치지 않고 지정된 DNS 서버에 직접 A/AAAA 질의를 보냅니다.</p>
 *
 * <p><strong>제약:</strong> JNDI 질의는 인터럽트할 수 없으므로 취소가 아닌 질의 타임아웃으로만 제한됩니다.
 * 질의는 UDP 1회 시도이며, 시도 타임아웃은 호출자가 넘긴 값입니다.</p>
 *
 * @author Watchdog Team
 * @since 1.0.0
 */
public final class JndiDnsResolver implements DnsResolver {

    private static final Logger log = LoggerFactory.getLogger(JndiDnsResolver.class);

    private static final String DNS_CONTEXT_FACTORY = "com.sun.jndi.dns.DnsContextFactory";
    private static final String TIMEOUT_INITIAL = "com.sun.jndi.dns.timeout.initial";
    private static final String TIMEOUT_RETRIES = "com.sun.jndi.dns.timeout.retries";
    private static final String[] ADDRESS_RECORDS = {"A", "AAAA"};

    @Override
    public List<String> resolve(String resolverAddress, String domain, Duration timeout) throws IOException {
        int timeoutMillis = TimeoutMillis.of(timeout);
        if (timeoutMillis == 0) {
            throw new SocketTimeoutException("DNS query timed out: no time remaining for " + domain);
        }

        Hashtable<String, String> environment = new Hashtable<>();
        environment.put(Context.INITIAL_CONTEXT_FACTORY, DNS_CONTEXT_FACTORY);
        environment.put(Context.PROVIDER_URL, "dns://" + resolverAddress);
        environment.put(TIMEOUT_INITIAL, String.valueOf(timeoutMillis));
        environment.put(TIMEOUT_RETRIES, "1");

        DirContext context = null;
        try {
            context = new InitialDirContext(environment);
            Attributes attributes = context.getAttributes(domain, ADDRESS_RECORDS);
            List<String> addresses = new ArrayList<>();
            for (String record : ADDRESS_RECORDS) {
                collect(attributes.get(record), addresses);
            }
            log.debug("Resolved {} via {}: {} addresses", domain, resolverAddress, addresses.size());
            return addresses;
        } catch (NameNotFoundException e) {
            UnknownHostException notFound = new UnknownHostException("no such host: " + domain);
            notFound.initCause(e);
            throw notFound;
        } catch (NamingException e) {
            throw new IOException("DNS lookup of " + domain + " via " + resolverAddress + " failed: "
                + e.getExplanation(), e);
        } finally {
            closeQuietly(context);
        }
    }

    private static void collect(Attribute attribute, List<String> addresses) throws NamingException {
        if (attribute == null) {
            return;
        }
        NamingEnumeration<?> values = attribute.getAll();
        while (values.hasMore()) {
            addresses.add(String.valueOf(values.next()));
        }
    }

    private static void closeQuietly(DirContext context) {
        if (context == null) {
            return;
        }
        try {
            context.close();
        } catch (NamingException e) {
            log.debug("Failed to close DNS context: {}", e.getMessage());
        }
    }
}

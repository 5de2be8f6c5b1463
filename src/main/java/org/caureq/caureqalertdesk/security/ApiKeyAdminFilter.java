package org.caureq.caureqalertdesk.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqalertdesk.config.AdminProps;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Guards /api/admin/** (rules and jobs): admin key first, then the IP allowlist.
 * Registered on the admin URL pattern only, see {@link FiltersConfig}.
 */
@Slf4j
@Component
public class ApiKeyAdminFilter implements Filter {
    private final String adminKey;
    private final List<String> cidrs;

    public ApiKeyAdminFilter(AdminProps props) {
        this.adminKey = props.apiKey();
        this.cidrs = props.allowIps().stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        var w = (HttpServletResponse) res;

        String k = r.getHeader("X-ADMIN-API-KEY");
        if (k == null || !k.equals(adminKey)) {
            w.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing/invalid admin key");
            return;
        }

        String ip = r.getRemoteAddr();
        if ("0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip)) ip = "127.0.0.1";

        if (!isAllowed(ip)) {
            log.warn("[Admin] rejected {} {} from {}", r.getMethod(), r.getRequestURI(), ip);
            w.sendError(HttpServletResponse.SC_FORBIDDEN, "IP not allowed: " + ip);
            return;
        }

        chain.doFilter(req, res);
    }

    boolean isAllowed(String ip) {
        for (var rule : cidrs) {
            if (rule.equals("*")) return true;
            if (!rule.contains("/")) {
                if (rule.equals(ip)) return true;
            } else if (matchesCidr(ip, rule)) {
                return true;
            }
        }
        return false;
    }

    // IPv4 only
    static boolean matchesCidr(String ip, String cidr) {
        String[] parts = cidr.split("/");
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            log.warn("[Admin] ignoring malformed allowlist entry {}", cidr);
            return false;
        }
        if (prefix < 0 || prefix > 32) return false;
        byte[] addr;
        byte[] net;
        try {
            addr = InetAddress.getByName(ip).getAddress();
            net = InetAddress.getByName(parts[0]).getAddress();
        } catch (UnknownHostException e) {
            log.warn("[Admin] cannot parse address {} or {}: {}", ip, cidr, e.getMessage());
            return false;
        }
        if (addr.length != 4 || net.length != 4) return false;

        int mask = prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
        return (toInt(addr) & mask) == (toInt(net) & mask);
    }

    private static int toInt(byte[] b) {
        return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
    }
}

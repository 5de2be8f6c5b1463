package org.caureq.caureqalertdesk.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.caureq.caureqalertdesk.config.AppProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Alert writes (create, status change, resolve, metadata) need X-API-KEY. Reads are open. */
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    private final AppProps props;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String path = req.getRequestURI();
        String method = req.getMethod();

        boolean needsKey = path.startsWith("/api/alerts")
                && !"GET".equalsIgnoreCase(method)
                && !"OPTIONS".equalsIgnoreCase(method)
                && !"HEAD".equalsIgnoreCase(method);

        if (needsKey) {
            String key = req.getHeader("X-API-KEY");
            if (key == null || !key.equals(props.apiKey())) {
                res.setStatus(HttpStatus.UNAUTHORIZED.value());
                res.setContentType("application/json");
                res.getWriter().write("{\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid X-API-KEY\"}");
                return;
            }
        }

        chain.doFilter(req, res);
    }
}

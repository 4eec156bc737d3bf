package xyz.firestige.redis.gateway.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * 在响应头 x-Process-Time 中返回请求处理耗时，格式 time:&lt;秒&gt;s
 * <p>
 * 响应头在写出响应体之前设置；阻塞命令的异步分派沿用首次分派记录的开始时间。
 */
public class ProcessTimeFilter extends OncePerRequestFilter {

    public static final String HEADER = "x-Process-Time";

    static final String START_ATTRIBUTE = ProcessTimeFilter.class.getName() + ".START";

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        Object recorded = request.getAttribute(START_ATTRIBUTE);
        long startNanos = recorded instanceof Long start ? start : System.nanoTime();
        request.setAttribute(START_ATTRIBUTE, startNanos);

        ProcessTimeResponse wrapped = new ProcessTimeResponse(response, startNanos);
        try {
            filterChain.doFilter(request, wrapped);
        } finally {
            if (!isAsyncStarted(request)) {
                wrapped.stamp();
            }
        }
    }

    static String format(long elapsedNanos) {
        return String.format(Locale.ROOT, "time:%.6fs", elapsedNanos / 1_000_000_000.0);
    }

    private static final class ProcessTimeResponse extends HttpServletResponseWrapper {

        private final long startNanos;

        ProcessTimeResponse(HttpServletResponse response, long startNanos) {
            super(response);
            this.startNanos = startNanos;
        }

        @Override
        public ServletOutputStream getOutputStream() throws IOException {
            stamp();
            return super.getOutputStream();
        }

        @Override
        public PrintWriter getWriter() throws IOException {
            stamp();
            return super.getWriter();
        }

        @Override
        public void flushBuffer() throws IOException {
            stamp();
            super.flushBuffer();
        }

        @Override
        public void sendError(int sc, String msg) throws IOException {
            stamp();
            super.sendError(sc, msg);
        }

        @Override
        public void sendError(int sc) throws IOException {
            stamp();
            super.sendError(sc);
        }

        void stamp() {
            if (!isCommitted() && !containsHeader(HEADER)) {
                setHeader(HEADER, format(System.nanoTime() - startNanos));
            }
        }
    }
}

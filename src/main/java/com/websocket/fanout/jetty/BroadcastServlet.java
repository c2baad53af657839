package com.websocket.fanout.jetty;

import com.websocket.fanout.BroadcastTrigger;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

public class BroadcastServlet extends HttpServlet {

    private final transient BroadcastTrigger trigger;

    public BroadcastServlet(BroadcastTrigger trigger) {
        this.trigger = trigger;
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        // raw URI so an encoded '/' stays inside the message segment
        String path = request.getRequestURI().substring(request.getContextPath().length());
        response.setContentType("text/plain");
        response.setCharacterEncoding("UTF-8");
        String body;
        try {
            body = trigger.handle(path);
            response.setStatus(HttpServletResponse.SC_OK);
        } catch (IllegalArgumentException e) {
            body = e.getMessage();
            response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
        }
        response.getWriter().write(body);
    }
}

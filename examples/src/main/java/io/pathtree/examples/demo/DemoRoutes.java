/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.pathtree.examples.demo;

import io.pathtree.Routes;
import io.pathtree.RouterOptions;
import io.pathtree.routing.RouteException;
import io.pathtree.routing.Router;
import io.pathtree.routing.tree.Node;
import org.xnio.OptionMap;

import java.util.List;
import java.util.Locale;

/**
 * Builds the routing tree of the demo application:
 * <pre>
 * /                        home
 * /auth/login              login form
 * /auth/register           registration form
 * /dashboard               dashboard
 * /dashboard/users_list    user list, or a single user with /dashboard/users_list/{id}
 * /dashboard/product_list  product list
 * </pre>
 * Everything else is answered by a not found page.
 */
public final class DemoRoutes {

    private static final String[][] USERS = {
            {"1", "Alice", "alice@example.com"},
            {"2", "Bob", "bob@example.com"},
            {"3", "Charlie", "charlie@example.com"},
            {"4", "Diana", "diana@example.com"},
            {"5", "Ethan", "ethan@example.com"},
    };

    private static final Object[][] PRODUCTS = {
            {"Laptop", 750.00, 10},
            {"Smartphone", 500.00, 25},
            {"Tablet", 300.00, 15},
            {"Headphones", 80.00, 50},
            {"Keyboard", 40.00, 40},
    };

    private DemoRoutes() {
    }

    public static Node createTree() {
        return Routes.node("root", arguments -> Page.ok("Welcome to the PathTree demo\n/auth/login\n/auth/register\n/dashboard\n"),
                Routes.node("auth",
                        Routes.node("login", arguments -> Page.ok("Login\nemail: ____\npassword: ____\n")),
                        Routes.node("register", arguments -> Page.ok("Register\nname: ____\nemail: ____\npassword: ____\n"))),
                Routes.node("dashboard", arguments -> Page.ok("Dashboard\nusers: " + USERS.length + "\nproducts: " + PRODUCTS.length + "\n"),
                        Routes.node("users_list", DemoRoutes::users),
                        Routes.node("product_list", arguments -> products())));
    }

    /**
     * Creates the demo router. Segments below the leaf routes are forwarded, which is how {@code users_list}
     * receives a user id.
     */
    public static Router createRouter() {
        return Routes.router(Routes.tree(createTree()), DemoRoutes::notFound,
                OptionMap.create(RouterOptions.FORWARD_UNCONSUMED_SEGMENTS, true));
    }

    static Page notFound(final RouteException exception) {
        return Page.notFound("404\nThe route " + exception.getPath() + " does not exist.\n");
    }

    private static Page users(final List<Object> arguments) {
        if (!arguments.isEmpty()) {
            final Object id = arguments.get(0);
            for (String[] user : USERS) {
                if (user[0].equals(id)) {
                    return Page.ok("User " + user[0] + "\n" + user[1] + " <" + user[2] + ">\n");
                }
            }
            return Page.notFound("404\nNo user with id " + id + "\n");
        }
        final StringBuilder body = new StringBuilder("Users\n");
        for (String[] user : USERS) {
            body.append(user[0]).append(' ').append(user[1]).append(" <").append(user[2]).append(">\n");
        }
        return Page.ok(body.toString());
    }

    private static Page products() {
        final StringBuilder body = new StringBuilder("Products\n");
        double total = 0;
        for (Object[] product : PRODUCTS) {
            final double price = (Double) product[1];
            final int quantity = (Integer) product[2];
            total += price * quantity;
            body.append(String.format(Locale.ROOT, "%s %.2f x %d%n", product[0], price, quantity));
        }
        body.append(String.format(Locale.ROOT, "Stock value %.2f%n", total));
        return Page.ok(body.toString());
    }
}

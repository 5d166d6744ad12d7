/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2024 Red Hat, Inc., and individual contributors
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

package io.routekit.examples.products;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An in-memory product store shared by the product routes.
 */
public final class ProductCatalog {

    private static final ProductCatalog DEFAULT = new ProductCatalog();

    static {
        DEFAULT.create("Laptop", 999.99, "A portable computer");
        DEFAULT.create("Phone", 699.99, "A smartphone");
        DEFAULT.create("Headphones", 149.5, "Noise cancelling");
    }

    private final Map<Long, Product> products = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    public static ProductCatalog getDefault() {
        return DEFAULT;
    }

    public List<Product> list(final String search, final int limit) {
        final List<Product> result = new ArrayList<>();
        final String needle = search == null ? null : search.toLowerCase(Locale.ENGLISH);
        for (Product product : products.values()) {
            if (needle == null || product.getName().toLowerCase(Locale.ENGLISH).contains(needle)) {
                result.add(product);
            }
        }
        result.sort(Comparator.comparingLong(Product::getId));
        return result.size() > limit ? result.subList(0, limit) : result;
    }

    public Product get(final long id) {
        return products.get(id);
    }

    public Product create(final String name, final double price, final String description) {
        final Product product = new Product(ids.incrementAndGet(), name, price, description);
        products.put(product.getId(), product);
        return product;
    }

    public Product replace(final long id, final ProductInput input) {
        return products.computeIfPresent(id, (key, existing) -> new Product(id, input.getName(), input.getPrice(), input.getDescription()));
    }

    public boolean delete(final long id) {
        return products.remove(id) != null;
    }

    /**
     * The featured products are the three most expensive ones.
     */
    public List<Product> featured() {
        final List<Product> result = new ArrayList<>(products.values());
        result.sort(Comparator.comparingDouble(Product::getPrice).reversed());
        return result.size() > 3 ? new ArrayList<>(result.subList(0, 3)) : result;
    }
}

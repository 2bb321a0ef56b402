package com.agile.Buro.Models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PageModel<T> {
    private List<T> items;
    private long total;
    private long skip;
    private int limit;
}

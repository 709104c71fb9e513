package com.sandkev.holdings.web;

import com.sandkev.holdings.history.NetValuePoint;
import com.sandkev.holdings.settings.Settings;
import com.sandkev.holdings.tax.CostBasis;
import com.sandkev.holdings.valuation.PortfolioSnapshot;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/portfolio")
class PortfolioController {

    private final PortfolioService portfolio;

    PortfolioController(PortfolioService portfolio) { this.portfolio = portfolio; }

    // GET /api/portfolio/balances?save=true
    @GetMapping("/balances")
    PortfolioSnapshot balances(@RequestParam(name = "save", defaultValue = "false") boolean save) {
        return portfolio.queryBalances(save);
    }

    @GetMapping("/exchanges")
    List<String> exchanges() { return portfolio.connectedExchanges(); }

    @PutMapping("/exchanges/{name}")
    OperationResult setupExchange(@PathVariable String name, @RequestBody ExchangeSetupRequest request) {
        return OperationResult.of(portfolio.setupExchange(name, request.apiKey(), request.apiSecret()));
    }

    @DeleteMapping("/exchanges/{name}")
    OperationResult removeExchange(@PathVariable String name) {
        return OperationResult.of(portfolio.removeExchange(name));
    }

    @GetMapping("/settings")
    Settings settings() { return portfolio.getSettings(); }

    @PutMapping("/settings")
    Settings updateSettings(@RequestBody Settings settings) {
        return portfolio.updateSettings(settings);
    }

    // PUT /api/portfolio/settings/main-currency?currency=EUR
    @PutMapping("/settings/main-currency")
    Settings setMainCurrency(@RequestParam String currency) {
        return portfolio.setMainCurrency(currency);
    }

    // PUT /api/portfolio/cost-basis  {"BTC":{"taxFreeAmount":0.5,"averageBuyValue":8000}}
    @PutMapping("/cost-basis")
    OperationResult publishCostBasis(@RequestBody Map<String, CostBasis> details) {
        portfolio.publishCostBasis(details);
        return OperationResult.ok();
    }

    @GetMapping("/history")
    List<NetValuePoint> history(@RequestParam(defaultValue = "30") int limit) {
        return portfolio.history(limit);
    }

    @PostMapping("/shutdown")
    OperationResult shutdown() {
        portfolio.shutdown();
        return OperationResult.ok();
    }
}

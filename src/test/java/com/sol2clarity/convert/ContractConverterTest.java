package com.sol2clarity.convert;

import java.util.List;

import com.sol2clarity.config.TranspilerConfig;
import com.sol2clarity.exception.UnsupportedConstructException;
import com.sol2clarity.generate.ExpressionRenderer;
import com.sol2clarity.model.source.ContractDefinition;
import com.sol2clarity.model.target.Atom;
import com.sol2clarity.model.target.Begin;
import com.sol2clarity.model.target.ClarityContract;
import com.sol2clarity.model.target.ClarityDefinition;
import com.sol2clarity.model.target.ClarityFunction;
import com.sol2clarity.model.target.ConstantDefinition;
import com.sol2clarity.model.target.DataVarDefinition;
import com.sol2clarity.model.target.EventDocumentation;
import com.sol2clarity.model.target.FunctionKind;
import com.sol2clarity.model.target.GetterDefinition;
import com.sol2clarity.model.target.GetterKind;
import com.sol2clarity.model.target.InitializationBlock;
import com.sol2clarity.model.target.MapDefinition;
import com.sol2clarity.model.target.ScalarType;
import com.sol2clarity.model.target.TupleType;
import com.sol2clarity.parser.SoliditySourceParser;
import com.sol2clarity.parser.SourceAstBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Solidity to Clarity lowering of a single contract.
 */
class ContractConverterTest {

    private final ContractConverter converter = new ContractConverter(TranspilerConfig.defaults());

    private ClarityContract convert(String source) {
        ContractDefinition contract = new SourceAstBuilder()
                .build(new SoliditySourceParser().parse(source))
                .getContracts().get(0);
        return converter.convert(contract);
    }

    private static ClarityFunction function(ClarityContract contract, String name) {
        return contract.definitionsOfType(ClarityFunction.class).stream()
                .filter(f -> f.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static String body(ClarityContract contract, String name) {
        return ExpressionRenderer.render(function(contract, name).getBody());
    }

    @Test
    void testCounterIncrement() {
        ClarityContract contract = convert("""
            contract Counter {
                uint256 count;
                function increment() public { count = count + 1; }
            }
            """);

        assertThat(contract.getUnitName()).isEqualTo("counter");
        DataVarDefinition count = (DataVarDefinition) contract.getDefinitions().get(0);
        assertThat(count.getName()).isEqualTo("count");
        assertThat(count.getType()).isEqualTo(ScalarType.UINT);
        assertThat(count.getInitialValue()).isEqualTo(new Atom("u0"));

        ClarityFunction increment = function(contract, "increment");
        assertThat(increment.getKind()).isEqualTo(FunctionKind.PUBLIC);
        assertThat(increment.getReturnType()).isEqualTo(ScalarType.BOOL);
        assertThat(ExpressionRenderer.render(increment.getBody()))
                .isEqualTo("(ok (var-set count (+ (var-get count) u1)))");
    }

    @Test
    void testPublicMappingGetsMapAndGetter() {
        ClarityContract contract = convert("""
            contract Bank { mapping(address => uint256) public balances; }
            """);

        assertThat(contract.getDefinitions()).hasSize(2);
        MapDefinition map = (MapDefinition) contract.getDefinitions().get(0);
        assertThat(map.getName()).isEqualTo("balances");
        assertThat(map.getKeyType()).isEqualTo(ScalarType.PRINCIPAL);
        assertThat(map.getValueType()).isEqualTo(ScalarType.UINT);
        assertThat(map.isFlattened()).isFalse();

        GetterDefinition getter = (GetterDefinition) contract.getDefinitions().get(1);
        assertThat(getter.getName()).isEqualTo("get-balances");
        assertThat(getter.getKind()).isEqualTo(GetterKind.MAP);
        assertThat(getter.getParameters()).hasSize(1);
        assertThat(getter.getParameters().get(0).getType()).isEqualTo(ScalarType.PRINCIPAL);
        assertThat(getter.getReturnType().render()).isEqualTo("(optional uint)");
        assertThat(ExpressionRenderer.render(getter.getBody())).isEqualTo("(ok (map-get? balances key))");
    }

    @Test
    void testNestedMappingIsFlattenedIntoTupleKey() {
        ClarityContract contract = convert("""
            contract Nft { mapping(address => mapping(uint256 => bool)) public approvals; }
            """);

        MapDefinition map = (MapDefinition) contract.getDefinitions().get(0);
        assertThat(map.getDepth()).isEqualTo(2);
        assertThat(map.getKeyType()).isInstanceOf(TupleType.class);
        assertThat(((TupleType) map.getKeyType()).getFields())
                .extracting(field -> field.getType())
                .containsExactly(ScalarType.PRINCIPAL, ScalarType.UINT);
        assertThat(map.getValueType()).isEqualTo(ScalarType.BOOL);

        GetterDefinition getter = (GetterDefinition) contract.getDefinitions().get(1);
        assertThat(getter.getParameters()).singleElement()
                .satisfies(p -> assertThat(p.getType()).isEqualTo(map.getKeyType()));
    }

    @Test
    void testMappingDepthMatchesKeyFieldCount() {
        ClarityContract contract = convert("""
            contract Deep {
                mapping(address => uint256) one;
                mapping(address => mapping(address => uint256)) two;
                mapping(address => mapping(uint256 => mapping(bool => string))) three;
            }
            """);

        List<MapDefinition> maps = contract.definitionsOfType(MapDefinition.class);
        assertThat(maps).extracting(MapDefinition::getDepth).containsExactly(1, 2, 3);
        assertThat(maps.get(2).getKeyType().render()).isEqualTo("{key-1: principal, key-2: uint, key-3: bool}");
        assertThat(maps.get(2).getValueType()).isEqualTo(ScalarType.stringAscii(256));
    }

    @Test
    void testNestedWritesUseTupleKeysInSourceOrder() {
        ClarityContract contract = convert("""
            contract Nft {
                mapping(address => mapping(uint256 => bool)) approvals;
                function approve(uint256 tokenId) public { approvals[msg.sender][tokenId] = true; }
            }
            """);

        MapDefinition map = (MapDefinition) contract.getDefinitions().get(0);
        assertThat(map.getKeyType().render()).isEqualTo("{sender: principal, token-id: uint}");
        assertThat(body(contract, "approve"))
                .isEqualTo("(ok (map-set approvals {sender: tx-sender, token-id: token-id} true))");
    }

    @Test
    void testTransferSequencesStoresAndWrapsOnlyTheLast() {
        ClarityContract contract = convert("""
            contract Token {
                mapping(address => uint256) balances;
                function transfer(address to, uint256 amount) public {
                    balances[msg.sender] = balances[msg.sender] - amount;
                    balances[to] = balances[to] + amount;
                }
            }
            """);

        ClarityFunction transfer = function(contract, "transfer");
        assertThat(transfer.getParameters()).extracting(p -> p.getName()).containsExactly("to", "amount");
        assertThat(transfer.getBody()).isInstanceOf(Begin.class);
        List<String> statements = ((Begin) transfer.getBody()).getExpressions().stream()
                .map(ExpressionRenderer::render)
                .toList();
        assertThat(statements).containsExactly(
                "(map-set balances tx-sender (- (default-to u0 (map-get? balances tx-sender)) amount))",
                "(ok (map-set balances to (+ (default-to u0 (map-get? balances to)) amount)))");
    }

    @Test
    void testGetterOnlyForPublicVariables() {
        ClarityContract contract = convert("""
            contract C {
                uint256 public a;
                uint256 private b;
                uint256 internal c;
                uint256 d;
                mapping(address => bool) public e;
                mapping(address => bool) f;
            }
            """);

        assertThat(contract.definitionsOfType(GetterDefinition.class))
                .extracting(GetterDefinition::getName)
                .containsExactly("get-a", "get-e");
        assertThat(contract.definitionsOfType(GetterDefinition.class))
                .extracting(g -> g.getParameters().size())
                .containsExactly(0, 1);
    }

    @Test
    void testDeclarationOrderIsPreserved() {
        ClarityContract contract = convert("""
            contract C {
                function first() public { }
                uint256 public value;
                event Changed(uint256 value);
                constructor() { value = 1; }
                mapping(address => uint256) balances;
                function last() public { }
            }
            """);

        assertThat(contract.getDefinitions())
                .extracting(d -> d.getClass().getSimpleName())
                .containsExactly("ClarityFunction", "DataVarDefinition", "GetterDefinition",
                        "EventDocumentation", "InitializationBlock", "MapDefinition", "ClarityFunction");
    }

    @Test
    void testFunctionKinds() {
        ClarityContract contract = convert("""
            contract C {
                uint256 count;
                function a() public { }
                function b() external view returns (uint256) { return count; }
                function c() public pure returns (bool) { return true; }
                function d() private { }
                function e() internal view { }
                function f() { }
                function g() external payable { }
            }
            """);

        assertThat(contract.definitionsOfType(ClarityFunction.class))
                .extracting(ClarityFunction::getKind)
                .containsExactly(FunctionKind.PUBLIC, FunctionKind.READ_ONLY, FunctionKind.READ_ONLY,
                        FunctionKind.PRIVATE, FunctionKind.PRIVATE, FunctionKind.PUBLIC, FunctionKind.PUBLIC);
        assertThat(function(contract, "b").getReturnType()).isEqualTo(ScalarType.UINT);
        assertThat(body(contract, "b")).isEqualTo("(ok (var-get count))");
        assertThat(body(contract, "a")).isEqualTo("(ok true)");
    }

    @Test
    void testSignedLiteralsStayBare() {
        ClarityContract contract = convert("""
            contract C {
                int256 delta = 5;
                function down() public { delta = delta - 1; }
            }
            """);

        DataVarDefinition delta = (DataVarDefinition) contract.getDefinitions().get(0);
        assertThat(delta.getInitialValue()).isEqualTo(new Atom("5"));
        assertThat(body(contract, "down")).isEqualTo("(ok (var-set delta (- (var-get delta) 1)))");
    }

    @Test
    void testFlatLeftToRightPrecedence() {
        ClarityContract contract = convert("""
            contract C {
                uint256 x;
                function f(uint256 a, uint256 b, uint256 c) public { x = a + b * c; }
                function g(uint256 a, uint256 b, uint256 c) public { x = a + (b * c); }
            }
            """);

        assertThat(body(contract, "f")).isEqualTo("(ok (var-set x (* (+ a b) c)))");
        assertThat(body(contract, "g")).isEqualTo("(ok (var-set x (+ a (* b c))))");
    }

    @Test
    void testOperatorTable() {
        ClarityContract contract = convert("""
            contract C {
                function ne(uint256 a, uint256 b) public view returns (bool) { return a != b; }
                function even(uint256 a) public pure returns (bool) { return a % 2 == 0; }
                function sq(uint256 a) public pure returns (uint256) { return a ** 2; }
                function both(bool p, bool q) public pure returns (bool) { return p && q; }
                function either(bool p, bool q) public pure returns (bool) { return p || q; }
            }
            """);

        assertThat(body(contract, "ne")).isEqualTo("(ok (not (is-eq a b)))");
        assertThat(body(contract, "even")).isEqualTo("(ok (is-eq (mod a u2) u0))");
        assertThat(body(contract, "sq")).isEqualTo("(ok (pow a u2))");
        assertThat(body(contract, "both")).isEqualTo("(ok (and p q))");
        assertThat(body(contract, "either")).isEqualTo("(ok (or p q))");
    }

    @Test
    void testConstantsAndInitializers() {
        ClarityContract contract = convert("""
            contract C {
                uint256 public constant MAX_SUPPLY = 1000;
                string public name = 'My "Token"';
                bool paused = true;
                function cap() public view returns (uint256) { return MAX_SUPPLY; }
            }
            """);

        ConstantDefinition max = (ConstantDefinition) contract.getDefinitions().get(0);
        assertThat(max.getName()).isEqualTo("max-supply");
        assertThat(max.getValue()).isEqualTo(new Atom("u1000"));
        GetterDefinition maxGetter = (GetterDefinition) contract.getDefinitions().get(1);
        assertThat(maxGetter.getName()).isEqualTo("get-max-supply");
        assertThat(ExpressionRenderer.render(maxGetter.getBody())).isEqualTo("(ok max-supply)");

        DataVarDefinition name = (DataVarDefinition) contract.getDefinitions().get(2);
        assertThat(name.getType()).isEqualTo(ScalarType.stringAscii(256));
        assertThat(name.getInitialValue()).isEqualTo(new Atom("\"My \\\"Token\\\"\""));

        DataVarDefinition paused = (DataVarDefinition) contract.getDefinitions().get(4);
        assertThat(paused.getInitialValue()).isEqualTo(new Atom("true"));

        assertThat(body(contract, "cap")).isEqualTo("(ok max-supply)");
    }

    @Test
    void testAddressDefaultsToDeployer() {
        ClarityContract contract = convert("contract C { address owner; }");

        DataVarDefinition owner = (DataVarDefinition) contract.getDefinitions().get(0);
        assertThat(owner.getType()).isEqualTo(ScalarType.PRINCIPAL);
        assertThat(owner.getInitialValue()).isEqualTo(new Atom("tx-sender"));
    }

    @Test
    void testParameterlessConstructorBecomesInitializationBlock() {
        ClarityContract contract = convert("""
            contract C {
                address owner;
                uint256 created;
                constructor() { owner = msg.sender; created = block.number; }
            }
            """);

        InitializationBlock init = (InitializationBlock) contract.getDefinitions().get(2);
        assertThat(init.getName()).isNull();
        assertThat(init.getExpressions()).extracting(ExpressionRenderer::render)
                .containsExactly("(var-set owner tx-sender)", "(var-set created block-height)");
    }

    @Test
    void testConstructorWithParametersBecomesInitFunction() {
        ClarityContract contract = convert("""
            contract C {
                uint256 supply;
                constructor(uint256 initialSupply) { supply = initialSupply; }
            }
            """);

        ClarityFunction init = function(contract, "init");
        assertThat(init.isInitializer()).isTrue();
        assertThat(init.getKind()).isEqualTo(FunctionKind.PUBLIC);
        assertThat(init.getParameters()).extracting(p -> p.getName()).containsExactly("initial-supply");
        assertThat(ExpressionRenderer.render(init.getBody())).isEqualTo("(ok (var-set supply initial-supply))");
    }

    @Test
    void testEmitBuildsPrintPayloadFromEventFields() {
        ClarityContract contract = convert("""
            contract C {
                event Transfer(address indexed from, address indexed to, uint256 value);
                function send(address to, uint256 amount) public { emit Transfer(msg.sender, to, amount); }
            }
            """);

        EventDocumentation event = (EventDocumentation) contract.getDefinitions().get(0);
        assertThat(event.getEventName()).isEqualTo("Transfer");
        assertThat(event.getFields()).extracting(f -> f.getName()).containsExactly("from", "to", "value");
        assertThat(body(contract, "send"))
                .isEqualTo("(ok (print {event: \"Transfer\", from: tx-sender, to: to, value: amount}))");
    }

    @Test
    void testParametersShadowStateVariables() {
        ClarityContract contract = convert("""
            contract C {
                uint256 amount;
                function f(uint256 amount) public pure returns (uint256) { return amount; }
                function g() public view returns (uint256) { return amount; }
            }
            """);

        assertThat(function(contract, "f").getParameters())
                .extracting(p -> p.getName())
                .containsExactly("amount-param");
        assertThat(body(contract, "f")).isEqualTo("(ok amount-param)");
        assertThat(body(contract, "g")).isEqualTo("(ok (var-get amount))");
    }

    @Test
    void testUnderscoreParameterIsRenamedAwayFromStateVariable() {
        ClarityContract contract = convert("""
            contract C {
                uint256 count;
                function setCount(uint256 _count) public { count = _count; }
            }
            """);

        assertThat(function(contract, "set-count").getParameters())
                .extracting(p -> p.getName())
                .containsExactly("count-param");
        assertThat(body(contract, "set-count")).isEqualTo("(ok (var-set count count-param))");
    }

    @Test
    void testParametersAvoidGetterAndFunctionNames() {
        ClarityContract contract = convert("""
            contract C {
                uint256 public total;
                constructor(uint256 init) { total = init; }
                function add(uint256 getTotal, uint256 add) public { total = getTotal + add; }
            }
            """);

        assertThat(function(contract, "init").getParameters())
                .extracting(p -> p.getName())
                .containsExactly("init-param");
        assertThat(function(contract, "add").getParameters())
                .extracting(p -> p.getName())
                .containsExactly("get-total-param", "add-param");
        assertThat(body(contract, "add")).isEqualTo("(ok (var-set total (+ get-total-param add-param)))");
    }

    @Test
    void testMapGetterKeyAvoidsStateVariableNamedKey() {
        ClarityContract contract = convert("""
            contract C {
                uint256 key;
                mapping(address => uint256) public balances;
            }
            """);

        GetterDefinition getter = (GetterDefinition) contract.getDefinitions().get(2);
        assertThat(getter.getParameters()).extracting(p -> p.getName()).containsExactly("key-param");
        assertThat(ExpressionRenderer.render(getter.getBody())).isEqualTo("(ok (map-get? balances key-param))");
    }

    @Test
    void testParameterClashingWithRenamedNameIsUnsupported() {
        assertUnsupported("""
            contract C {
                uint256 count;
                uint256 countParam;
                function f(uint256 _count) public { }
            }
            """, "name collision");
    }

    @Test
    void testStateVariablesDeclaredLaterAreVisible() {
        ClarityContract contract = convert("""
            contract C {
                function bump() public { total = total + 1; }
                uint256 total;
            }
            """);

        assertThat(body(contract, "bump")).isEqualTo("(ok (var-set total (+ (var-get total) u1)))");
    }

    @Test
    void testContractsAreConvertedIndependently() {
        String source = """
            contract TokenA { uint256 public supply; }
            contract TokenB { function f() public { supply = 1; } }
            """;
        List<ContractDefinition> contracts = new SourceAstBuilder()
                .build(new SoliditySourceParser().parse(source))
                .getContracts();

        ClarityContract a = converter.convert(contracts.get(0));
        assertThat(a.getUnitName()).isEqualTo("token-a");

        assertThatThrownBy(() -> converter.convert(contracts.get(1)))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("supply is not a declared state variable");
    }

    @Test
    void testInheritanceIsUnsupported() {
        assertUnsupported("contract Child is Base { }", "inheritance");
    }

    @Test
    void testUnknownTypeIsUnsupported() {
        assertUnsupported("contract C { fixed128x18 price; }", "type fixed128x18");
    }

    @Test
    void testBitwiseOperatorIsUnsupported() {
        assertUnsupported("""
            contract C { uint256 x; function f(uint256 a) public { x = a & 1; } }
            """, "operator &");
    }

    @Test
    void testEarlyReturnIsUnsupported() {
        assertUnsupported("""
            contract C { uint256 x; function f() public returns (uint256) { return 1; x = 2; } }
            """, "early return");
    }

    @Test
    void testReturnInConstructorIsUnsupported() {
        assertUnsupported("""
            contract C { constructor() { return; } }
            """, "return in constructor");
    }

    @Test
    void testUndeclaredEventIsUnsupported() {
        assertUnsupported("""
            contract C { function f() public { emit Missing(1); } }
            """, "emit");
    }

    @Test
    void testEmitArgumentCountMismatchIsUnsupported() {
        assertUnsupported("""
            contract C { event E(uint256 a); function f() public { emit E(1, 2); } }
            """, "emit");
    }

    @Test
    void testAssignmentToConstantIsUnsupported() {
        assertUnsupported("""
            contract C { uint256 constant LIMIT = 5; function f() public { LIMIT = 6; } }
            """, "assignment");
    }

    @Test
    void testConstantWithoutValueIsUnsupported() {
        assertUnsupported("contract C { uint256 constant LIMIT; }", "constant without value");
    }

    @Test
    void testMappingWithoutIndexIsUnsupported() {
        assertUnsupported("""
            contract C { mapping(address => uint256) m; function f() public view returns (uint256) { return m; } }
            """, "mapping value");
    }

    @Test
    void testWrongIndexCountIsUnsupported() {
        assertUnsupported("""
            contract C {
                mapping(address => mapping(address => uint256)) m;
                function f(address a) public view returns (uint256) { return m[a]; }
            }
            """, "index access");
    }

    @Test
    void testGetterNameCollisionIsUnsupported() {
        assertUnsupported("""
            contract C { uint256 public x; function getX() public { } }
            """, "name collision");
    }

    @Test
    void testKebabCaseCollisionIsUnsupported() {
        assertUnsupported("""
            contract C { uint256 totalSupply; uint256 total_supply; }
            """, "name collision");
    }

    @Test
    void testGetterCollisionSuggestsRename() {
        assertThatThrownBy(() -> convert("""
            contract C {
                uint256 public value;
                function getValue() public view returns (uint256) { return value; }
            }
            """))
                .isInstanceOf(UnsupportedConstructException.class)
                .hasMessageContaining("getter for value and function getValue both map to Clarity name 'get-value'")
                .hasMessageContaining("rename the function or make the variable non-public");
    }

    @Test
    void testParametersWithSameKebabNameAreUnsupported() {
        assertUnsupported("""
            contract C { function f(uint256 aB, uint256 a_b) public { } }
            """, "duplicate parameter");
    }

    @Test
    void testEventFieldsWithSameKebabNameAreUnsupported() {
        assertUnsupported("""
            contract C {
                event E(uint256 fromA, uint256 from_a);
                function f() public { emit E(1, 2); }
            }
            """, "name collision");
    }

    @Test
    void testEventFieldNamedEventIsUnsupported() {
        assertUnsupported("contract C { event Logged(uint256 event_); }", "name collision");
    }

    @Test
    void testDeclaredReturnWithoutReturnStatementIsUnsupported() {
        assertUnsupported("""
            contract C { uint256 x; function f() public returns (uint256) { x = 5; } }
            """, "missing return");
        assertUnsupported("""
            contract C { function f() public pure returns (bool) { } }
            """, "missing return");
    }

    @Test
    void testMappingParameterIsUnsupported() {
        assertUnsupported("""
            contract C { function f(mapping(address => uint256) storage m) internal { } }
            """, "mapping type");
    }

    @Test
    void testEveryDefinitionNameIsKebabCase() {
        ClarityContract contract = convert("""
            contract MyToken {
                uint256 public totalSupply;
                mapping(address => uint256) public balanceOf;
                function mintTokens(address recipientAddress, uint256 tokenAmount) public { }
            }
            """);

        assertThat(contract.getUnitName()).isEqualTo("my-token");
        assertThat(contract.getDefinitions())
                .extracting(ClarityDefinition::getName)
                .containsExactly("total-supply", "get-total-supply", "balance-of", "get-balance-of", "mint-tokens");
        assertThat(function(contract, "mint-tokens").getParameters())
                .extracting(p -> p.getName())
                .containsExactly("recipient-address", "token-amount");
    }

    private void assertUnsupported(String source, String construct) {
        assertThatThrownBy(() -> convert(source))
                .isInstanceOf(UnsupportedConstructException.class)
                .satisfies(e -> assertThat(((UnsupportedConstructException) e).getConstruct()).isEqualTo(construct));
    }
}
